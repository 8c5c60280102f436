package com.pocketai.catalog.hub;

import java.util.List;

/**
 * Read-only view of the external model hub.
 */
public interface HubCatalogClient {

    /**
     * List at most {@code limit} public models matching {@code filterLabel}.
     * Pagination is handled internally; callers always get one flat batch.
     *
     * @throws CatalogUnavailableException when the hub cannot be reached,
     *         rate-limits the request or rejects the query
     */
    List<HubModelDescriptor> listItems(String filterLabel, int limit) throws CatalogUnavailableException;
}
