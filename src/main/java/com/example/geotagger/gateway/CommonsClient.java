package com.example.geotagger.gateway;

import com.example.geotagger.model.ContinuationCursor;
import com.example.geotagger.model.ItemDetail;
import com.example.geotagger.model.ItemRecord;
import com.example.geotagger.model.ListingPage;
import com.example.geotagger.model.RawEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.JavaNetCookieJar;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Session-holding client for a MediaWiki API. Create it with {@link #login}, use it for one run and
 * close it; closing removes the temporary download directory.
 */
public final class CommonsClient implements ListingGateway, ItemDetailSource, PayloadTransport, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(CommonsClient.class);
    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
    private static final String FILE_PREFIX = "File:";
    private static final String CATEGORY_PREFIX = "Category:";
    private static final int LIST_PAGE_SIZE = 50;
    private static final Set<String> AUTH_ERRORS = Set.of(
            "notloggedin", "permissiondenied", "badtoken", "assertuserfailed", "assertbotfailed",
            "mwoauth-invalid-authorization", "readapidenied", "writeapidenied"
    );

    private final OkHttpClient http;
    private final HttpUrl apiUrl;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Path downloadDirectory;
    private final boolean ownsDownloadDirectory;
    private String csrfToken;

    private CommonsClient(CommonsSettings settings) throws IOException {
        HttpUrl parsed = HttpUrl.parse(settings.apiUrl());
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid API url: " + settings.apiUrl());
        }
        this.apiUrl = parsed;
        String userAgent = settings.userAgent();
        this.http = new OkHttpClient.Builder()
                .cookieJar(new JavaNetCookieJar(new CookieManager(null, CookiePolicy.ACCEPT_ALL)))
                .callTimeout(settings.timeout())
                .readTimeout(settings.timeout())
                .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                        .header("User-Agent", userAgent)
                        .build()))
                .build();
        if (settings.downloadDirectory().isPresent()) {
            this.downloadDirectory = Files.createDirectories(settings.downloadDirectory().get());
            this.ownsDownloadDirectory = false;
        } else {
            this.downloadDirectory = Files.createTempDirectory("geotagger-");
            this.ownsDownloadDirectory = true;
        }
    }

    /**
     * Opens a session and logs in with a bot password.
     *
     * @throws FatalAuthException if the credentials are rejected
     */
    public static CommonsClient login(CommonsSettings settings, String user, String password) throws IOException {
        CommonsClient client = new CommonsClient(settings);
        try {
            client.authenticate(user, password);
            return client;
        } catch (IOException | RuntimeException ex) {
            client.close();
            throw ex;
        }
    }

    private void authenticate(String user, String password) throws GatewayException {
        JsonNode tokens = call(params("action", "query", "meta", "tokens", "type", "login"));
        String loginToken = tokens.path("query").path("tokens").path("logintoken").asText("");
        if (loginToken.isEmpty()) {
            throw new FatalAuthException("No login token returned by " + apiUrl);
        }
        JsonNode login = call(params("action", "login", "lgname", user, "lgpassword", password, "lgtoken", loginToken));
        String result = login.path("login").path("result").asText();
        if (!"Success".equals(result)) {
            throw new FatalAuthException("Login failed for " + user + ": "
                    + login.path("login").path("reason").asText(result));
        }
        JsonNode csrf = call(params("action", "query", "meta", "tokens"));
        this.csrfToken = csrf.path("query").path("tokens").path("csrftoken").asText("");
        LOGGER.info("Logged in to {} as {}", apiUrl.host(), user);
    }

    @Override
    public ListingPage listPage(CrawlScope scope, ContinuationCursor cursor) throws GatewayException {
        JsonNode token = cursor == null ? null : cursor.token();
        if (scope instanceof UserUploadsScope) {
            return listUploads((UserUploadsScope) scope, token);
        }
        if (scope instanceof CategoryScope) {
            return listCategory((CategoryScope) scope, token);
        }
        if (scope instanceof ExplicitListScope) {
            return listExplicit((ExplicitListScope) scope, token);
        }
        throw new IllegalArgumentException("Unsupported scope " + scope);
    }

    private ListingPage listUploads(UserUploadsScope scope, JsonNode token) throws GatewayException {
        Map<String, String> params = params(
                "action", "query",
                "list", "logevents",
                "letype", "upload",
                "leuser", scope.user(),
                "leprop", "title",
                "lelimit", "max");
        if (token != null) {
            if ("user".equals(token.path("type").asText()) && scope.user().equals(token.path("user").asText())) {
                mergeContinue(params, token.path("continue"));
            } else {
                LOGGER.warn("Ignoring continuation cursor from a different scope; restarting {}", scope.describe());
            }
        }
        JsonNode data = call(params);
        List<RawEntry> entries = new ArrayList<>();
        for (JsonNode event : data.path("query").path("logevents")) {
            String title = event.path("title").asText("");
            if (!title.isEmpty()) {
                entries.add(RawEntry.ofTitle(title));
            }
        }
        JsonNode cont = data.get("continue");
        if (cont == null || !cont.isObject()) {
            return ListingPage.last(entries);
        }
        ObjectNode next = mapper.createObjectNode();
        next.put("type", "user");
        next.put("user", scope.user());
        next.set("continue", cont.deepCopy());
        return new ListingPage(entries, Optional.of(new ContinuationCursor(next)));
    }

    private ListingPage listCategory(CategoryScope scope, JsonNode token) throws GatewayException {
        CategoryWalk walk = CategoryWalk.fromCursor(token, scope).orElse(null);
        if (walk == null) {
            if (token != null) {
                LOGGER.warn("Ignoring continuation cursor from a different scope; restarting {}", scope.describe());
            }
            walk = CategoryWalk.start(scope);
        }
        List<RawEntry> entries = new ArrayList<>();
        // Keep walking until there is something to return, so an empty page always means the end.
        while (entries.isEmpty() && !walk.isExhausted()) {
            CategoryWalk.Frame frame = walk.head();
            Map<String, String> params = params(
                    "action", "query",
                    "list", "categorymembers",
                    "cmtitle", CATEGORY_PREFIX + frame.category(),
                    "cmtype", "file|subcat",
                    "cmprop", "title|type",
                    "cmlimit", "max");
            mergeContinue(params, walk.memberContinue());
            JsonNode data = call(params);
            for (JsonNode member : data.path("query").path("categorymembers")) {
                String title = member.path("title").asText("");
                String type = member.path("type").asText("");
                if ("subcat".equals(type)) {
                    walk.enqueueSubcategory(stripPrefix(title, CATEGORY_PREFIX), frame.depth());
                } else if ("file".equals(type) && !title.isEmpty()) {
                    entries.add(RawEntry.ofTitle(title));
                }
            }
            JsonNode cont = data.get("continue");
            walk.advance(cont != null && cont.isObject() ? ((ObjectNode) cont).deepCopy() : null);
        }
        if (walk.isExhausted()) {
            return ListingPage.last(entries);
        }
        return new ListingPage(entries, Optional.of(new ContinuationCursor(walk.toCursor(mapper, scope.category()))));
    }

    private ListingPage listExplicit(ExplicitListScope scope, JsonNode token) {
        int offset = 0;
        if (token != null && "list".equals(token.path("type").asText())) {
            offset = Math.max(0, token.path("offset").asInt(0));
        }
        List<String> ids = scope.ids();
        int end = Math.min(ids.size(), offset + LIST_PAGE_SIZE);
        List<RawEntry> entries = new ArrayList<>();
        for (int i = Math.min(offset, ids.size()); i < end; i++) {
            entries.add(new RawEntry(ids.get(i)));
        }
        if (end >= ids.size()) {
            return ListingPage.last(entries);
        }
        ObjectNode next = mapper.createObjectNode();
        next.put("type", "list");
        next.put("offset", end);
        return new ListingPage(entries, Optional.of(new ContinuationCursor(next)));
    }

    @Override
    public List<ItemDetail> fetchDetails(List<String> ids) throws GatewayException {
        if (ids.isEmpty()) {
            return List.of();
        }
        if (ids.size() > MAX_BATCH) {
            throw new IllegalArgumentException("At most " + MAX_BATCH + " ids per detail request");
        }
        List<String> titles = ids.stream().map(id -> FILE_PREFIX + id).toList();
        JsonNode data = call(params(
                "action", "query",
                "prop", "imageinfo|coordinates|info",
                "iiprop", "url|metadata|extmetadata",
                "iiextmetadatafilter", "Artist",
                "titles", String.join("|", titles)));

        // The API may normalize titles (underscores, case); map them back to the ids we asked for.
        Map<String, String> requested = new HashMap<>();
        for (String id : ids) {
            requested.put(id, id);
        }
        for (JsonNode normalized : data.path("query").path("normalized")) {
            String from = RawEntry.ofTitle(normalized.path("from").asText()).id();
            String to = RawEntry.ofTitle(normalized.path("to").asText()).id();
            if (requested.containsKey(from)) {
                requested.put(to, from);
            }
        }

        List<ItemDetail> details = new ArrayList<>();
        for (JsonNode page : data.path("query").path("pages")) {
            String returned = RawEntry.ofTitle(page.path("title").asText("")).id();
            String id = requested.getOrDefault(returned, returned);
            details.add(parseDetail(id, page));
        }
        return details;
    }

    private ItemDetail parseDetail(String id, JsonNode page) {
        if (page.path("missing").asBoolean(false) || page.path("invalid").asBoolean(false)) {
            return ItemDetail.missing(id);
        }
        boolean redirect = page.path("redirect").asBoolean(false);
        Double lat = null;
        Double lon = null;
        JsonNode coordinates = page.path("coordinates");
        if (coordinates.isArray() && coordinates.size() > 0) {
            lat = doubleOrNull(coordinates.get(0).get("lat"));
            lon = doubleOrNull(coordinates.get(0).get("lon"));
        }
        JsonNode imageInfo = page.path("imageinfo").path(0);
        boolean embedded = false;
        Double gpsLat = null;
        Double gpsLon = null;
        for (JsonNode entry : imageInfo.path("metadata")) {
            String name = entry.path("name").asText();
            if ("GPSLatitude".equals(name)) {
                gpsLat = doubleOrNull(entry.get("value"));
            } else if ("GPSLongitude".equals(name)) {
                gpsLon = doubleOrNull(entry.get("value"));
            }
        }
        if (gpsLat != null && gpsLon != null) {
            embedded = true;
        }
        String url = imageInfo.hasNonNull("url") ? imageInfo.get("url").asText() : null;
        String author = null;
        JsonNode artist = imageInfo.path("extmetadata").path("Artist").path("value");
        if (artist.isTextual()) {
            author = artist.asText().replaceAll("<[^>]+>", "").trim();
            if (author.isEmpty()) {
                author = null;
            }
        }
        return new ItemDetail(id, false, redirect, lat, lon, embedded, url, author);
    }

    @Override
    public Path download(ItemRecord record) throws IOException {
        if (record.sourceUrl() == null) {
            throw new IOException("No download url for " + record.id());
        }
        HttpUrl url = HttpUrl.parse(record.sourceUrl());
        if (url == null) {
            throw new IOException("Invalid download url for " + record.id() + ": " + record.sourceUrl());
        }
        Path target = downloadDirectory.resolve(record.id().replace('/', '_'));
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = http.newCall(request).execute()) {
            checkStatus(response);
            ResponseBody body = response.body();
            if (body == null) {
                throw new TransientFetchException("Empty download for " + record.id());
            }
            try (InputStream in = body.byteStream()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        LOGGER.debug("Downloaded {} to {}", record.id(), target);
        return target;
    }

    @Override
    public void publish(ItemRecord record, Path file, String comment) throws IOException {
        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("action", "upload")
                .addFormDataPart("format", "json")
                .addFormDataPart("formatversion", "2")
                .addFormDataPart("filename", record.id())
                .addFormDataPart("comment", comment)
                .addFormDataPart("ignorewarnings", "1")
                .addFormDataPart("token", csrfToken == null ? "" : csrfToken)
                .addFormDataPart("file", record.id(), RequestBody.create(file.toFile(), OCTET_STREAM))
                .build();
        JsonNode data = execute(new Request.Builder().url(apiUrl).post(body).build());
        String result = data.path("upload").path("result").asText();
        if (!"Success".equals(result) && !"Warning".equals(result)) {
            throw new IOException("Upload of " + record.id() + " returned " + result);
        }
        LOGGER.info("Uploaded new revision of {}", record.id());
    }

    /**
     * Directory that receives downloaded payloads.
     */
    public Path downloadDirectory() {
        return downloadDirectory;
    }

    @Override
    public void close() {
        http.dispatcher().executorService().shutdown();
        http.connectionPool().evictAll();
        if (ownsDownloadDirectory) {
            deleteRecursively(downloadDirectory);
        }
    }

    private JsonNode call(Map<String, String> params) throws GatewayException {
        FormBody.Builder form = new FormBody.Builder();
        params.forEach(form::add);
        form.add("format", "json");
        form.add("formatversion", "2");
        form.add("maxlag", "5");
        return execute(new Request.Builder().url(apiUrl).post(form.build()).build());
    }

    private JsonNode execute(Request request) throws GatewayException {
        try (Response response = http.newCall(request).execute()) {
            checkStatus(response);
            ResponseBody body = response.body();
            if (body == null) {
                throw new TransientFetchException("Empty response from " + apiUrl);
            }
            JsonNode data = mapper.readTree(body.byteStream());
            checkApiError(data);
            return data;
        } catch (GatewayException ex) {
            throw ex;
        } catch (IOException ex) {
            throw new TransientFetchException("Request to " + request.url().host() + " failed", ex);
        }
    }

    private void checkStatus(Response response) throws GatewayException {
        int code = response.code();
        if (response.isSuccessful()) {
            return;
        }
        if (code == 401 || code == 403) {
            throw new FatalAuthException("HTTP " + code + " from " + response.request().url().host());
        }
        throw new TransientFetchException("HTTP " + code + " from " + response.request().url().host());
    }

    private void checkApiError(JsonNode data) throws GatewayException {
        JsonNode error = data == null ? null : data.get("error");
        if (error == null || error.isNull()) {
            return;
        }
        String code = error.path("code").asText("unknown");
        String info = error.path("info").asText("");
        if (AUTH_ERRORS.contains(code)) {
            throw new FatalAuthException("API error " + code + ": " + info);
        }
        throw new TransientFetchException("API error " + code + ": " + info);
    }

    private void mergeContinue(Map<String, String> params, JsonNode cont) {
        if (cont == null || !cont.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = cont.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            params.put(field.getKey(), field.getValue().asText());
        }
    }

    private static Map<String, String> params(String... keyValues) {
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            params.put(keyValues[i], keyValues[i + 1]);
        }
        return params;
    }

    private static String stripPrefix(String title, String prefix) {
        return title.startsWith(prefix) ? title.substring(prefix.length()) : title;
    }

    private static Double doubleOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private void deleteRecursively(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException ex) {
                    LOGGER.warn("Failed to delete {}", path, ex);
                }
            });
        } catch (IOException ex) {
            LOGGER.warn("Failed to clean up download directory {}", root, ex);
        }
    }
}
