package com.ekslens.leadmaster.lead.model;

public record IndustryChangeResponse(String requested, boolean fellBack, IndustryInfo industry) {
}
