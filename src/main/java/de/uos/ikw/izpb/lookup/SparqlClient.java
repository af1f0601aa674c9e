package de.uos.ikw.izpb.lookup;

import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.json.JsonMapper;
import de.uos.ikw.izpb.formats.SparqlResponse;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;

/**
 * Minimal SPARQL client for the Wikidata query service (GET requests, JSON results).
 */
public class SparqlClient {
    public static final String WIKIDATA_ENDPOINT = "https://query.wikidata.org/sparql";

    private static final ObjectReader RESPONSE_READER = JsonMapper.builder().findAndAddModules().build()
            .readerFor(SparqlResponse.class);

    private final HttpUrl endpoint;
    private final String userAgent;
    private final OkHttpClient httpClient;

    /**
     * @param endpoint  Query service URL.
     * @param userAgent User-Agent header; Wikidata blocks clients without a descriptive one.
     * @param timeout   Timeout of a whole request.
     */
    public SparqlClient(String endpoint, String userAgent, Duration timeout) {
        this.endpoint = HttpUrl.get(endpoint);
        this.userAgent = userAgent;
        this.httpClient = new OkHttpClient.Builder()
                .callTimeout(timeout)
                .readTimeout(timeout)
                .build();
    }

    public SparqlResponse query(String sparql) throws LookupException {
        HttpUrl url = endpoint.newBuilder()
                .addQueryParameter("query", sparql)
                .addQueryParameter("format", "json")
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", userAgent)
                .header("Accept", "application/sparql-results+json")
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new LookupException("SPARQL endpoint answered HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new LookupException("SPARQL endpoint answered without body");
            }
            return RESPONSE_READER.readValue(body.byteStream());
        } catch (IOException e) {
            throw new LookupException("SPARQL request failed: " + e.getMessage(), e);
        }
    }
}
