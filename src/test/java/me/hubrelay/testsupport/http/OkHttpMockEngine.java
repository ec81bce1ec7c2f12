package me.hubrelay.testsupport.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory OkHttp interceptor for adapter tests.
 * <p>
 * Never touches the network: responses and failures are queued up front and
 * every request is recorded for assertions.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ConcurrentLinkedQueue<Planned> planned = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Request> requests = new ConcurrentLinkedQueue<>();

    public void enqueueJson(int code, String body) {
        planned.add(new Planned(code, body != null ? body : "", null));
    }

    public void enqueueFailure(IOException failure) {
        planned.add(new Planned(0, "", failure));
    }

    public Request takeRequest() {
        return requests.poll();
    }

    public int getRequestCount() {
        return requests.size();
    }

    /**
     * Path plus encoded query of a recorded request.
     */
    public static String target(Request request) {
        String query = request.url().encodedQuery();
        return query == null ? request.url().encodedPath() : request.url().encodedPath() + "?" + query;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        requests.add(request);

        Planned next = planned.poll();
        if (next == null) {
            throw new IOException("No planned response for " + request.method() + " " + request.url());
        }
        if (next.failure() != null) {
            throw next.failure();
        }
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(next.code())
                .message("mock")
                .headers(Headers.of())
                .body(ResponseBody.create(next.body().getBytes(StandardCharsets.UTF_8), JSON))
                .build();
    }

    private record Planned(int code, String body, IOException failure) {
    }
}
