package com.ekslens.leadmaster.lead.collector;

public interface BrowserSessionFactory {
    BrowserSession open();
}
