package io.keyserver.core.model;

/**
 * Closed set of request messages a route can bind. Each route binding names
 * exactly one variant at registration time, so handlers receive the concrete
 * type without casting.
 *
 * <p>
 * Messages are mutable decode targets: the route's parameter parser fills the
 * path- and query-derived fields, then the JSON body is decoded over them. An
 * instance belongs to a single request and is discarded afterwards.
 */
public sealed interface RequestMessage
        permits GetEntryRequest,
                ListEntryHistoryRequest,
                UpdateEntryRequest,
                ListSehRequest,
                ListUpdateRequest,
                ListStepsRequest,
                HkpLookupRequest {}
