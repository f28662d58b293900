package de.upb.sse.casegen.fixtures;

public class Value {
    private int value;
    private String label = "none";

    public int getValue() {
        return value;
    }

    public void setValue(int value) {
        this.value = value;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label == null ? "none" : label.trim();
    }
}
