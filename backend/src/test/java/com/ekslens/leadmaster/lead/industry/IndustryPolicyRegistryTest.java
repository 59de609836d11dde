package com.ekslens.leadmaster.lead.industry;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.model.IndustryInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IndustryPolicyRegistryTest {

    @Test
    void unknownIndustryFallsBackToDefault() {
        IndustryPolicyRegistry registry = registry("medical_aesthetics");

        assertThat(registry.resolve("underwater_basket_weaving").id()).isEqualTo(MedicalAestheticsPolicy.ID);
        assertThat(registry.resolve(null).id()).isEqualTo(MedicalAestheticsPolicy.ID);
        assertThat(registry.isKnown("underwater_basket_weaving")).isFalse();
    }

    @Test
    void resolvesIgnoringCaseAndWhitespace() {
        IndustryPolicyRegistry registry = registry("medical_aesthetics");

        assertThat(registry.resolve("  Real_Estate ").id()).isEqualTo(RealEstatePolicy.ID);
        assertThat(registry.isKnown("REAL_ESTATE")).isTrue();
    }

    @Test
    void configuredDefaultIsHonoured() {
        IndustryPolicyRegistry registry = registry("real_estate");

        assertThat(registry.defaultPolicy().id()).isEqualTo(RealEstatePolicy.ID);
        assertThat(registry.resolve("nope").id()).isEqualTo(RealEstatePolicy.ID);
    }

    @Test
    void describeTruncatesPreviews() {
        IndustryPolicyRegistry registry = registry("medical_aesthetics");

        List<IndustryInfo> infos = registry.describeAll();

        assertThat(infos).extracting(IndustryInfo::id).containsExactly(MedicalAestheticsPolicy.ID, RealEstatePolicy.ID);
        IndustryInfo medical = infos.get(0);
        assertThat(medical.name()).isEqualTo("Medical Aesthetics");
        assertThat(medical.searchTerms()).hasSize(5);
        assertThat(medical.companyIndicators()).hasSize(5);
        assertThat(medical.keywords()).contains("botox");
    }

    private static IndustryPolicyRegistry registry(String defaultIndustry) {
        LeadMasterProperties properties = new LeadMasterProperties();
        properties.setDefaultIndustry(defaultIndustry);
        return new IndustryPolicyRegistry(List.of(new MedicalAestheticsPolicy(), new RealEstatePolicy()), properties);
    }
}
