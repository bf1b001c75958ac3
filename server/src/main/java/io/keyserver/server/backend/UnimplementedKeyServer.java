package io.keyserver.server.backend;

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
import io.keyserver.core.spi.KeyServer;

/**
 * Backend used when no key server is wired in. Every operation fails with
 * {@link BackendException.Status#UNIMPLEMENTED}, so the REST surface answers
 * {@code 501} once a request has been bound successfully.
 */
public final class UnimplementedKeyServer implements KeyServer {

    @Override
    public GetEntryResponse getEntry(RequestContext ctx, GetEntryRequest request) {
        throw unimplemented("GetEntry");
    }

    @Override
    public ListEntryHistoryResponse listEntryHistory(RequestContext ctx, ListEntryHistoryRequest request) {
        throw unimplemented("ListEntryHistory");
    }

    @Override
    public UpdateEntryResponse updateEntry(RequestContext ctx, UpdateEntryRequest request) {
        throw unimplemented("UpdateEntry");
    }

    @Override
    public ListSehResponse listSeh(RequestContext ctx, ListSehRequest request) {
        throw unimplemented("ListSEH");
    }

    @Override
    public ListUpdateResponse listUpdate(RequestContext ctx, ListUpdateRequest request) {
        throw unimplemented("ListUpdate");
    }

    @Override
    public ListStepsResponse listSteps(RequestContext ctx, ListStepsRequest request) {
        throw unimplemented("ListSteps");
    }

    @Override
    public HkpLookupResponse hkpLookup(RequestContext ctx, HkpLookupRequest request) {
        throw unimplemented("HkpLookup");
    }

    private static BackendException unimplemented(String operation) {
        return new BackendException(BackendException.Status.UNIMPLEMENTED, operation + " is not implemented");
    }
}
