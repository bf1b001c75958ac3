package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OpenPGP HTTP Keyserver Protocol lookup ({@code /pks/lookup} style). All three
 * parameters are optional strings taken verbatim from the query string.
 */
public final class HkpLookupRequest implements RequestMessage {

    @JsonProperty("op")
    private String op = "";

    @JsonProperty("search")
    private String search = "";

    @JsonProperty("options")
    private String options = "";

    public String getOp() {
        return op;
    }

    public void setOp(String op) {
        this.op = op;
    }

    public String getSearch() {
        return search;
    }

    public void setSearch(String search) {
        this.search = search;
    }

    public String getOptions() {
        return options;
    }

    public void setOptions(String options) {
        this.options = options;
    }

    @Override
    public String toString() {
        return "HkpLookupRequest[op=" + op + ", search=" + search + ", options=" + options + "]";
    }
}
