package com.ekslens.leadmaster.lead.api;

public record IndustryChangeRequest(String industry) {
}
