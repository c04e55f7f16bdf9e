package nl.bytesoflife.deltasdf;

public class SemanticException extends SdfException {

    public SemanticException(String message) {
        super(message);
    }
}
