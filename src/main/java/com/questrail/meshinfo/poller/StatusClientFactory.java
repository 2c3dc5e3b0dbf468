package com.questrail.meshinfo.poller;

/**
 * Opens a {@link StatusClient} session for one poll pass.
 */
@FunctionalInterface
public interface StatusClientFactory
{
    StatusClient open();
}
