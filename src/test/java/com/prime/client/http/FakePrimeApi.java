package com.prime.client.http;

import com.prime.client.error.CancelledException;
import com.prime.client.fetch.PageRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory stand-in for the API server.
 *
 * <p>Serves the {@code data.json} / {@code op.json} listings, count probes and
 * pages of synthetic records ({@code {"@id": n, "name": "<resource>-<n>"}}).
 * Individual pages can be delayed or made to fail by offset. Records every call
 * and the highest number of calls in flight at once.</p>
 */
public class FakePrimeApi implements HttpTransport {

    public static final String BASE_URL = "https://prime.test";
    public static final String API_URL = BASE_URL + "/webacs/api/v1/";

    private final Map<String, Long> dataResources = new LinkedHashMap<>();
    private final Map<String, String> services = new LinkedHashMap<>();
    private final Map<Long, Integer> failingOffsets = new ConcurrentHashMap<>();
    private final Map<Long, Long> delaysMs = new ConcurrentHashMap<>();
    private final Map<String, Long> reportedCounts = new ConcurrentHashMap<>();
    private final List<HttpCall> calls = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile int catalogStatus = 200;
    private volatile int probeStatus = 200;
    private volatile String countKey = "@count";

    public FakePrimeApi withData(String name, long records) {
        dataResources.put(name, records);
        return this;
    }

    public FakePrimeApi withService(String name, String method) {
        services.put(name, method);
        return this;
    }

    /** The count probe reports {@code count} while the pages still serve the real records. */
    public FakePrimeApi reportCount(String name, long count) {
        reportedCounts.put(name, count);
        return this;
    }

    public FakePrimeApi failPage(long offset, int status) {
        failingOffsets.put(offset, status);
        return this;
    }

    public FakePrimeApi delayPage(long offset, long millis) {
        delaysMs.put(offset, millis);
        return this;
    }

    public FakePrimeApi catalogStatus(int status) {
        this.catalogStatus = status;
        return this;
    }

    public FakePrimeApi probeStatus(int status) {
        this.probeStatus = status;
        return this;
    }

    public FakePrimeApi countKey(String countKey) {
        this.countKey = countKey;
        return this;
    }

    public static String dataUrl(String name) {
        return API_URL + "data/" + name;
    }

    public static String serviceUrl(String name) {
        return API_URL + "op/" + name;
    }

    public List<HttpCall> calls() {
        return List.copyOf(calls);
    }

    public List<HttpCall> pageCalls() {
        return calls.stream().filter(c -> c.queryParams().containsKey(PageRequest.FIRST_RESULT)).toList();
    }

    public List<HttpCall> callsTo(String url) {
        return calls.stream().filter(c -> c.url().equals(url)).toList();
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }

    public void resetCalls() {
        calls.clear();
        maxInFlight.set(0);
    }

    @Override
    public HttpResult execute(HttpCall call) {
        calls.add(call);
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            return respond(call);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private HttpResult respond(HttpCall call) {
        String url = call.url();
        if (url.equals(API_URL + "data.json")) {
            return catalogStatus != 200 ? status(call, catalogStatus) : ok(call, dataListing());
        }
        if (url.equals(API_URL + "op.json")) {
            return catalogStatus != 200 ? status(call, catalogStatus) : ok(call, serviceListing());
        }
        for (Map.Entry<String, Long> resource : dataResources.entrySet()) {
            if (url.equals(dataUrl(resource.getKey()))) {
                return call.queryParams().containsKey(PageRequest.FIRST_RESULT)
                        ? page(call, resource.getKey(), resource.getValue())
                        : probe(call, resource.getKey(), resource.getValue());
            }
        }
        for (Map.Entry<String, String> service : services.entrySet()) {
            if (url.equals(serviceUrl(service.getKey()))) {
                return ok(call, "{\"mgmtResponse\":{\"service\":\"" + service.getKey()
                        + "\",\"method\":\"" + call.method() + "\"}}");
            }
        }
        return status(call, 404);
    }

    private HttpResult probe(HttpCall call, String name, long records) {
        if (probeStatus != 200) {
            return status(call, probeStatus);
        }
        long count = reportedCounts.getOrDefault(name, records);
        return ok(call, "{\"queryResponse\":{\"@type\":\"" + name + "\",\"" + countKey + "\":" + count
                + ",\"@first\":0,\"@last\":" + Math.max(count - 1, 0) + "}}");
    }

    private HttpResult page(HttpCall call, String name, long records) {
        long first = Long.parseLong(String.valueOf(call.queryParams().get(PageRequest.FIRST_RESULT)));
        int max = Integer.parseInt(String.valueOf(call.queryParams().get(PageRequest.MAX_RESULTS)));
        Long delay = delaysMs.get(first);
        if (delay != null) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancelledException("Request interrupted", e);
            }
        }
        Integer failure = failingOffsets.get(first);
        if (failure != null) {
            return status(call, failure);
        }
        List<String> entities = new ArrayList<>();
        for (long id = first; id < Math.min(first + max, records); id++) {
            entities.add("{\"@id\":" + id + ",\"name\":\"" + name + "-" + id + "\"}");
        }
        long count = reportedCounts.getOrDefault(name, records);
        return ok(call, "{\"queryResponse\":{\"@type\":\"" + name + "\",\"" + countKey + "\":" + count
                + ",\"@first\":" + first + ",\"entity\":[" + String.join(",", entities) + "]}}");
    }

    private String dataListing() {
        return "{\"queryResponse\":{\"entityType\":[" + dataResources.keySet().stream()
                .map(name -> "{\"$\":\"" + name + "\",\"@url\":\"/webacs/api/v1/data/" + name + "\"}")
                .collect(Collectors.joining(",")) + "]}}";
    }

    private String serviceListing() {
        return "{\"mgmtResponse\":{\"operation\":[" + services.entrySet().stream()
                .map(s -> "{\"@displayName\":\"" + s.getKey() + "\",\"@httpMethod\":\"" + s.getValue()
                        + "\",\"@path\":\"op/" + s.getKey() + "\"}")
                .collect(Collectors.joining(",")) + "]}}";
    }

    private static HttpResult ok(HttpCall call, String body) {
        return new HttpResult(200, body, call.fullUrl());
    }

    private static HttpResult status(HttpCall call, int status) {
        return new HttpResult(status, "", call.fullUrl());
    }
}
