package org.catalogapi.export.solr;

/**
 * What Solr answered to one update request.
 */
public record SolrResponse(int statusCode, String statusText, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
