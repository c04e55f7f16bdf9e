package nl.bytesoflife.deltasdf.model;

public enum Edge {
    POSEDGE("posedge"),
    NEGEDGE("negedge");

    private final String text;

    Edge(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
