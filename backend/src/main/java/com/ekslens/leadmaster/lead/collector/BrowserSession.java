package com.ekslens.leadmaster.lead.collector;

/**
 * An automated browser bound to one collector invocation. Implementations bound every page
 * operation by a timeout; {@link #close()} never throws.
 */
public interface BrowserSession extends AutoCloseable {

    boolean login(String loginUrl, String username, String password);

    /** Loads the page, lets lazy content render and returns the resulting HTML. */
    String loadPage(String url);

    @Override
    void close();
}
