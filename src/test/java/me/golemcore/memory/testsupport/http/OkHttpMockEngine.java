package me.golemcore.memory.testsupport.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory OkHttp exchange engine for unit tests.
 * <p>
 * This interceptor never performs network I/O. Tests enqueue responses (or
 * failures), and every request is captured for assertions.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ConcurrentLinkedQueue<PlannedResult> plannedResults = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CapturedRequest> capturedRequests = new ConcurrentLinkedQueue<>();

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public void enqueueJson(int code, String body) {
        plannedResults.add(new PlannedResult(code, body != null ? body : "", null));
    }

    /**
     * Enqueues a successful Qdrant response wrapping {@code resultJson}.
     */
    public void enqueueResult(String resultJson) {
        enqueueJson(200, "{\"result\":" + resultJson + ",\"status\":\"ok\",\"time\":0.001}");
    }

    public void enqueueFailure(IOException failure) {
        plannedResults.add(new PlannedResult(0, "", failure));
    }

    public CapturedRequest takeRequest() {
        return capturedRequests.poll();
    }

    public int getRequestCount() {
        return capturedRequests.size();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        capturedRequests.add(new CapturedRequest(request, readRequestBody(request)));

        PlannedResult plannedResult = plannedResults.poll();
        if (plannedResult == null) {
            throw new IOException("No planned response for request: " + request.method() + " " + request.url());
        }
        if (plannedResult.failure() != null) {
            throw plannedResult.failure();
        }

        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(plannedResult.code())
                .message("mock")
                .headers(Headers.of())
                .body(ResponseBody.create(plannedResult.body(), JSON))
                .build();
    }

    private String readRequestBody(Request request) throws IOException {
        RequestBody requestBody = request.body();
        if (requestBody == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        requestBody.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record PlannedResult(int code, String body, IOException failure) {
    }

    public static final class CapturedRequest {
        private final Request request;
        private final String body;

        private CapturedRequest(Request request, String body) {
            this.request = request;
            this.body = body;
        }

        public String method() {
            return request.method();
        }

        public String target() {
            String encodedPath = request.url().encodedPath();
            String encodedQuery = request.url().encodedQuery();
            if (encodedQuery == null || encodedQuery.isBlank()) {
                return encodedPath;
            }
            return encodedPath + "?" + encodedQuery;
        }

        public String header(String name) {
            return request.header(name);
        }

        public String body() {
            return body;
        }
    }
}
