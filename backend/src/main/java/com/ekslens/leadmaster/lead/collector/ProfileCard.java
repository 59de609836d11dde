package com.ekslens.leadmaster.lead.collector;

public record ProfileCard(String name, String profileUrl, String headline, String location) {
}
