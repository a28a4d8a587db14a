package com.example.smart_proxy.model;

import java.net.URI;

/**
 * Where the callback leg sends the browser.
 *
 * @param permanent {@code true} for the compound-code redirect (301), {@code false} for the error
 *     pass-through (302)
 */
public record ClientRedirect(URI location, boolean permanent) {}
