package com.ekslens.leadmaster.lead.augment;

import com.ekslens.leadmaster.lead.model.OutreachContext;

public interface TextAugmenter {

    boolean isConfigured();

    /**
     * Drafts one outreach message.
     *
     * @throws TextAugmentationException when the draft could not be produced
     */
    String draft(OutreachContext context);
}
