package com.ekslens.leadmaster.lead.api;

public record ManualLeadRequest(
    String name,
    String website,
    String description,
    String location,
    String email,
    String phone
) {
}
