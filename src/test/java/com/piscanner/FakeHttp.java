package com.piscanner;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

/**
 * Application interceptor that answers every call itself, so tests never touch the network.
 */
public final class FakeHttp implements Interceptor {
    private final List<Request> requests = new CopyOnWriteArrayList<>();
    private final Responder responder;

    private FakeHttp(Responder responder) {
        this.responder = responder;
    }

    public static FakeHttp responding(Responder responder) {
        return new FakeHttp(responder);
    }

    public static FakeHttp respond(int code, String body) {
        return new FakeHttp(request -> new Reply(code, body));
    }

    public static FakeHttp failing(IOException failure) {
        return new FakeHttp(request -> {
            throw failure;
        });
    }

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public List<Request> requests() {
        return requests;
    }

    public static String bodyOf(Request request) throws IOException {
        Buffer buffer = new Buffer();
        if (request.body() != null) {
            request.body().writeTo(buffer);
        }
        return buffer.readUtf8();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        requests.add(request);
        Reply reply = responder.reply(request);
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(reply.code())
                .message("fake")
                .body(ResponseBody.create(reply.body(), MediaType.parse("application/json")))
                .build();
    }

    @FunctionalInterface
    public interface Responder {
        Reply reply(Request request) throws IOException;
    }

    public record Reply(int code, String body) {
    }
}
