package com.ekslens.leadmaster.lead.industry;

import com.ekslens.leadmaster.lead.model.Lead;
import com.ekslens.leadmaster.lead.model.OutreachContext;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MedicalAestheticsPolicyTest {
    private final MedicalAestheticsPolicy policy = new MedicalAestheticsPolicy();

    @Test
    void acceptsClinicWithProductKeyword() {
        assertThat(policy.validate(lead("Clínica Botox Madrid", "aesthetic clinic", null))).isTrue();
        assertThat(policy.validate(lead("Clínica Botox Madrid", null, null))).isTrue();
    }

    @Test
    void rejectsCandidateWithoutPositiveIndicators() {
        assertThat(policy.validate(lead("Hospital General", "public hospital", null))).isFalse();
    }

    @Test
    void negativeIndicatorsMustBeOutweighed() {
        assertThat(policy.validate(lead("University botox study", null, null))).isFalse();
        assertThat(policy.validate(lead("Hospital aesthetic clinic", null, null))).isTrue();
    }

    @Test
    void indicatorsAreMatchedInUrlAndDescription() {
        assertThat(policy.validate(lead("Dr. Ana Ruiz", "Especialista en rellenos", "https://example.es/fillers"))).isTrue();
    }

    @Test
    void searchParamsTargetSpanishGoogle() {
        Map<String, String> params = policy.buildSearchParams("botox", "madrid");

        assertThat(params)
            .containsEntry("location", "madrid")
            .containsEntry("hl", "es")
            .containsEntry("gl", "es")
            .containsEntry("google_domain", "google.es")
            .containsEntry("num", "10");
        assertThat(params.get("q")).startsWith("\"botox\" \"madrid\"").contains("clinic OR aesthetic");
    }

    @Test
    void practitionerVariationsOnlyForSpecificProducts() {
        assertThat(policy.keywordVariations("Botox", "valencia"))
            .containsExactly("especialista Botox valencia", "doctor Botox valencia");
        assertThat(policy.keywordVariations("aesthetic clinic", "valencia")).isEmpty();
    }

    @Test
    void profileSearchUrlEncodesTermAndOffset() {
        String url = policy.profileSearchUrl("https://www.linkedin.com/search/results/people/", "botox madrid", 20);

        assertThat(url).isEqualTo(
            "https://www.linkedin.com/search/results/people/?keywords=botox%20madrid&origin=GLOBAL_SEARCH_HEADER&start=20"
        );
    }

    @Test
    void outreachContextCarriesLeadDetails() {
        OutreachContext context = policy.buildOutreachContext(lead("Clínica Bella", "Tratamientos faciales", null));

        assertThat(context.industry()).isEqualTo("medicina estética");
        assertThat(context.leadName()).isEqualTo("Clínica Bella");
        assertThat(context.leadDescription()).isEqualTo("Tratamientos faciales");
        assertThat(context.products()).contains("botox");
    }

    private static Lead lead(String name, String description, String url) {
        return new Lead(name, url, description, "SerpApi", "botox madrid", null, "organic-search", "madrid", null, null, Instant.now());
    }
}
