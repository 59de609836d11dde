package com.ekslens.leadmaster.lead.model;

public enum LeadGroupField {
    SOURCE("source"),
    STATUS("status"),
    INDUSTRY("industry");

    private final String column;

    LeadGroupField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
