package io.keyserver.core.binding;

import io.keyserver.core.model.GetEntryRequest;
import io.keyserver.core.model.GetEntryResponse;
import io.keyserver.core.model.HkpLookupRequest;
import io.keyserver.core.model.HkpLookupResponse;
import io.keyserver.core.model.HttpMethod;
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
import java.util.List;

/**
 * Route bindings of the key server REST API.
 *
 * <p>
 * Each factory method is the initializer of one route. It runs once, when the
 * route table is built; the returned binding allocates a fresh message per
 * request.
 */
public final class KeyServerRoutes {

    /** Path variable naming the user in the {@code users} routes. */
    public static final String USER_ID = "user_id";

    /** Body field of {@code Key} carrying an RFC3339 creation time. */
    public static final String CREATION_TIME = "creation_time";

    static final String EPOCH = "epoch";
    static final String APP_ID = "app_id";
    static final String START_EPOCH = "start_epoch";
    static final String PAGE_SIZE = "page_size";
    static final String START_COMMITMENT_TIMESTAMP = "start_commitment_timestamp";
    static final String HKP_OP = "op";
    static final String HKP_SEARCH = "search";
    static final String HKP_OPTIONS = "options";

    private KeyServerRoutes() {
        // utility class
    }

    /** All key server routes. */
    public static RouteTable<KeyServer> table() {
        return RouteTable.<KeyServer>builder()
                .add(getEntryV1())
                .add(hkpLookup())
                .add(getEntryV2())
                .add(listEntryHistoryV2())
                .add(updateEntryV2())
                .add(listSehV2())
                .add(listUpdateV2())
                .add(listStepsV2())
                .build();
    }

    // ── v1 ──

    /** {@code GET /v1/users/{user_id}?epoch=&app_id=} */
    public static RouteBinding<KeyServer, GetEntryRequest, GetEntryResponse> getEntryV1() {
        return new RouteBinding<>(
                "GetEntryV1",
                "/v1/users/{" + USER_ID + "}",
                HttpMethod.GET,
                GetEntryRequest::new,
                KeyServerRoutes::parseGetEntry,
                KeyServer::getEntry,
                List.of());
    }

    /** {@code GET /v1/hkp/lookup?op=&search=&options=} */
    public static RouteBinding<KeyServer, HkpLookupRequest, HkpLookupResponse> hkpLookup() {
        return new RouteBinding<>(
                "HkpLookup",
                "/v1/hkp/lookup",
                HttpMethod.GET,
                HkpLookupRequest::new,
                KeyServerRoutes::parseHkpLookup,
                KeyServer::hkpLookup,
                List.of());
    }

    // ── v2 ──

    /** {@code GET /v2/users/{user_id}?epoch=&app_id=} */
    public static RouteBinding<KeyServer, GetEntryRequest, GetEntryResponse> getEntryV2() {
        return new RouteBinding<>(
                "GetEntryV2",
                "/v2/users/{" + USER_ID + "}",
                HttpMethod.GET,
                GetEntryRequest::new,
                KeyServerRoutes::parseGetEntry,
                KeyServer::getEntry,
                List.of());
    }

    /** {@code GET /v2/users/{user_id}/history?start_epoch=&page_size=} */
    public static RouteBinding<KeyServer, ListEntryHistoryRequest, ListEntryHistoryResponse> listEntryHistoryV2() {
        return new RouteBinding<>(
                "ListEntryHistoryV2",
                "/v2/users/{" + USER_ID + "}/history",
                HttpMethod.GET,
                ListEntryHistoryRequest::new,
                KeyServerRoutes::parseListEntryHistory,
                KeyServer::listEntryHistory,
                List.of());
    }

    /** {@code PUT /v2/users/{user_id}} with a signed key body. */
    public static RouteBinding<KeyServer, UpdateEntryRequest, UpdateEntryResponse> updateEntryV2() {
        return new RouteBinding<>(
                "UpdateEntryV2",
                "/v2/users/{" + USER_ID + "}",
                HttpMethod.PUT,
                UpdateEntryRequest::new,
                (request, message) -> message.setUserId(PathVariables.require(request, USER_ID)),
                KeyServer::updateEntry,
                List.of(CREATION_TIME));
    }

    /** {@code GET /v2/seh?start_epoch=&page_size=} */
    public static RouteBinding<KeyServer, ListSehRequest, ListSehResponse> listSehV2() {
        return new RouteBinding<>(
                "ListSEHV2",
                "/v2/seh",
                HttpMethod.GET,
                ListSehRequest::new,
                (request, message) -> {
                    message.setStartEpoch(QueryParameters.unsigned64(request, START_EPOCH));
                    message.setPageSize(QueryParameters.nonNegative32(request, PAGE_SIZE));
                },
                KeyServer::listSeh,
                List.of());
    }

    /** {@code GET /v2/updates?start_commitment_timestamp=&page_size=} */
    public static RouteBinding<KeyServer, ListUpdateRequest, ListUpdateResponse> listUpdateV2() {
        return new RouteBinding<>(
                "ListUpdateV2",
                "/v2/updates",
                HttpMethod.GET,
                ListUpdateRequest::new,
                (request, message) -> {
                    message.setStartCommitmentTimestamp(
                            QueryParameters.unsigned64(request, START_COMMITMENT_TIMESTAMP));
                    message.setPageSize(QueryParameters.nonNegative32(request, PAGE_SIZE));
                },
                KeyServer::listUpdate,
                List.of());
    }

    /** {@code GET /v2/steps?start_commitment_timestamp=&page_size=} */
    public static RouteBinding<KeyServer, ListStepsRequest, ListStepsResponse> listStepsV2() {
        return new RouteBinding<>(
                "ListStepsV2",
                "/v2/steps",
                HttpMethod.GET,
                ListStepsRequest::new,
                (request, message) -> {
                    message.setStartCommitmentTimestamp(
                            QueryParameters.unsigned64(request, START_COMMITMENT_TIMESTAMP));
                    message.setPageSize(QueryParameters.nonNegative32(request, PAGE_SIZE));
                },
                KeyServer::listSteps,
                List.of());
    }

    // ── parsers shared between versions ──

    static void parseGetEntry(BoundRequest request, GetEntryRequest message) {
        message.setUserId(PathVariables.require(request, USER_ID));
        message.setEpoch(QueryParameters.unsigned64(request, EPOCH));
        message.setAppId(QueryParameters.string(request, APP_ID));
    }

    static void parseListEntryHistory(BoundRequest request, ListEntryHistoryRequest message) {
        message.setUserId(PathVariables.require(request, USER_ID));
        message.setStartEpoch(QueryParameters.unsigned64(request, START_EPOCH));
        message.setPageSize(QueryParameters.nonNegative32(request, PAGE_SIZE));
    }

    static void parseHkpLookup(BoundRequest request, HkpLookupRequest message) {
        message.setOp(QueryParameters.string(request, HKP_OP));
        message.setSearch(QueryParameters.string(request, HKP_SEARCH));
        message.setOptions(QueryParameters.string(request, HKP_OPTIONS));
    }
}
