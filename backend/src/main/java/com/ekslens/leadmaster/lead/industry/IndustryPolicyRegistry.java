package com.ekslens.leadmaster.lead.industry;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.model.IndustryInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps industry identifiers to policies. Unknown identifiers resolve to the configured default
 * policy instead of failing.
 */
@Component
public class IndustryPolicyRegistry {
    private static final Logger log = LoggerFactory.getLogger(IndustryPolicyRegistry.class);
    private static final int INFO_PREVIEW_SIZE = 5;

    private final Map<String, IndustryPolicy> policies = new LinkedHashMap<>();
    private final IndustryPolicy defaultPolicy;

    public IndustryPolicyRegistry(List<IndustryPolicy> policies, LeadMasterProperties properties) {
        for (IndustryPolicy policy : policies) {
            this.policies.put(normalizeId(policy.id()), policy);
        }
        IndustryPolicy configuredDefault = this.policies.get(normalizeId(properties.getDefaultIndustry()));
        if (configuredDefault == null) {
            configuredDefault = this.policies.get(MedicalAestheticsPolicy.ID);
        }
        if (configuredDefault == null) {
            throw new IllegalStateException("No default industry policy registered");
        }
        this.defaultPolicy = configuredDefault;
    }

    public IndustryPolicy resolve(String industryId) {
        IndustryPolicy policy = policies.get(normalizeId(industryId));
        if (policy == null) {
            log.warn("Unknown industry '{}', falling back to {}", industryId, defaultPolicy.id());
            return defaultPolicy;
        }
        return policy;
    }

    public boolean isKnown(String industryId) {
        return policies.containsKey(normalizeId(industryId));
    }

    public IndustryPolicy defaultPolicy() {
        return defaultPolicy;
    }

    public List<String> availableIds() {
        return List.copyOf(policies.keySet());
    }

    public List<IndustryInfo> describeAll() {
        List<IndustryInfo> infos = new ArrayList<>();
        for (IndustryPolicy policy : policies.values()) {
            infos.add(describe(policy));
        }
        return infos;
    }

    public static IndustryInfo describe(IndustryPolicy policy) {
        return new IndustryInfo(
            policy.id(),
            policy.name(),
            policy.defaultKeywords(),
            preview(policy.searchTerms()),
            preview(policy.companyIndicators())
        );
    }

    private static List<String> preview(List<String> values) {
        return values.size() <= INFO_PREVIEW_SIZE ? values : List.copyOf(values.subList(0, INFO_PREVIEW_SIZE));
    }

    private static String normalizeId(String industryId) {
        return industryId == null ? "" : industryId.trim().toLowerCase(Locale.ROOT);
    }
}
