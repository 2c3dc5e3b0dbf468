package com.questrail.meshinfo.poller;

import java.io.IOException;

/**
 * StatusClient
 * -----------------------------------------------------------------------------
 * Port for fetching the status document of a single node.
 *
 * <p>A client is a session: it is opened for one poll pass, shared by every
 * fetch of that pass, and closed when the pass ends. Implementations must be
 * safe for concurrent {@link #fetch(String)} calls.</p>
 */
public interface StatusClient extends AutoCloseable
{
    /** Status document path on every node. */
    String STATUS_PATH = "/cgi-bin/sysinfo.json";

    /** Query requesting local services and link details. */
    String STATUS_QUERY = "services_local=1&link_info=1";

    /** Port the node web server listens on. */
    int STATUS_PORT = 8080;

    /**
     * Fetch the status document from a node.
     *
     * @return the response, whatever its status code
     * @throws java.net.SocketTimeoutException when connecting or reading times out
     * @throws IOException on any other transport fault
     */
    StatusResponse fetch(String address) throws IOException;

    /**
     * Release session resources. Idempotent.
     */
    @Override
    void close();
}
