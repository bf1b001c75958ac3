package io.keyserver.core.spi;

import io.keyserver.core.binding.RequestContext;
import io.keyserver.core.error.BackendException;
import io.keyserver.core.model.GetEntryRequest;
import io.keyserver.core.model.GetEntryResponse;
import io.keyserver.core.model.HkpLookupRequest;
import io.keyserver.core.model.HkpLookupResponse;
import io.keyserver.core.model.ListEntryHistoryRequest;
import io.keyserver.core.model.ListEntryHistoryResponse;
import io.keyserver.core.model.ListSehRequest;
import io.keyserver.core.model.ListSehResponse;
import io.keyserver.core.model.ListStepsRequest;
import io.keyserver.core.model.ListStepsResponse;
import io.keyserver.core.model.ListUpdateRequest;
import io.keyserver.core.model.ListUpdateResponse;
import io.keyserver.core.model.UpdateEntryRequest;
import io.keyserver.core.model.UpdateEntryResponse;

/**
 * Key server backend. The REST layer binds each route to one of these methods
 * and never looks behind them.
 *
 * <p>
 * Implementations report failures as {@link BackendException}; its
 * {@link BackendException.Status} decides the HTTP status of the response.
 * Any other runtime exception is answered with {@code 500}.
 *
 * <p>
 * Implementations MUST be thread-safe. A single instance serves all
 * concurrent requests.
 */
public interface KeyServer {

    GetEntryResponse getEntry(RequestContext ctx, GetEntryRequest request);

    ListEntryHistoryResponse listEntryHistory(RequestContext ctx, ListEntryHistoryRequest request);

    UpdateEntryResponse updateEntry(RequestContext ctx, UpdateEntryRequest request);

    ListSehResponse listSeh(RequestContext ctx, ListSehRequest request);

    ListUpdateResponse listUpdate(RequestContext ctx, ListUpdateRequest request);

    ListStepsResponse listSteps(RequestContext ctx, ListStepsRequest request);

    HkpLookupResponse hkpLookup(RequestContext ctx, HkpLookupRequest request);
}
