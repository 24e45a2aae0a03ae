package com.shlokmestry.campaignbridge.provider;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlokmestry.campaignbridge.settings.PluginSettings;

// Lookups are cached per API key; refresh skips the read but still rewrites the entry.
@Component
public final class MailchimpProvider implements EmailProvider {

    private static final Logger log = LoggerFactory.getLogger(MailchimpProvider.class);

    static final Pattern API_KEY_PATTERN = Pattern.compile("^[a-f0-9]{32}-us[0-9]+$");

    private static final String AUDIENCES_PREFIX = "cb_mc_audiences_";
    private static final String TEMPLATES_PREFIX = "cb_mc_templates_";
    private static final String SECTIONS_PREFIX = "cb_mc_sections_";

    private static final TypeReference<List<Audience>> AUDIENCE_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Template>> TEMPLATE_LIST = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final RestClient http;
    private final MailchimpProperties properties;
    private final ProviderCache cache;
    private final ObjectMapper json;

    public MailchimpProvider(RestClient mailchimpRestClient, MailchimpProperties properties,
                             ProviderCache cache, ObjectMapper json) {
        this.http = mailchimpRestClient;
        this.properties = properties;
        this.cache = cache;
        this.json = json;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.MAILCHIMP;
    }

    @Override
    public boolean isConfigured(PluginSettings settings) {
        return settings.hasApiKey() && isValidApiKey(settings.apiKey());
    }

    public static boolean isValidApiKey(String apiKey) {
        return apiKey != null && API_KEY_PATTERN.matcher(apiKey).matches();
    }

    @Override
    public Set<Capability> capabilities() {
        return EnumSet.of(Capability.AUDIENCES, Capability.TEMPLATES, Capability.SCHEDULING, Capability.ANALYTICS);
    }

    public List<Audience> audiences(PluginSettings settings, boolean refresh) {
        String apiKey = requireKey(settings);
        String dc = dataCenter(apiKey);

        return cached(AUDIENCES_PREFIX + md5(apiKey), AUDIENCE_LIST, refresh, () -> {
            JsonNode body = fetch(apiKey, properties.baseUrl(dc) + "/lists?count=1000", "Failed to fetch audiences.");
            return collect(body.path("lists"), n -> new Audience(n.path("id").asText(), n.path("name").asText()));
        });
    }

    public List<Template> templates(PluginSettings settings, boolean refresh) {
        String apiKey = requireKey(settings);
        String dc = dataCenter(apiKey);

        return cached(TEMPLATES_PREFIX + md5(apiKey), TEMPLATE_LIST, refresh, () -> {
            JsonNode body = fetch(apiKey, properties.baseUrl(dc) + "/templates?type=user&count=1000", "Failed to fetch templates.");
            return collect(body.path("templates"), n -> new Template(n.path("id").asLong(), n.path("name").asText()));
        });
    }

    @Override
    public List<String> sectionKeys(PluginSettings settings, boolean refresh) {
        if (!settings.hasApiKey() || settings.templateId() == null || settings.templateId() <= 0) {
            throw ProviderException.badRequest("missing_settings", "API key and Template ID are required.");
        }
        String apiKey = settings.apiKey();
        String dc = dataCenter(apiKey);
        long templateId = settings.templateId();

        return cached(SECTIONS_PREFIX + md5(apiKey + "|" + templateId), STRING_LIST, refresh, () -> {
            JsonNode body = fetch(apiKey, properties.baseUrl(dc) + "/templates/" + templateId + "/default-content",
                    "Failed to fetch template.");
            List<String> keys = new ArrayList<>();
            Iterator<String> names = body.path("sections").fieldNames();
            names.forEachRemaining(keys::add);
            return keys;
        });
    }

    private static String requireKey(PluginSettings settings) {
        if (!settings.hasApiKey()) {
            throw ProviderException.badRequest("missing_key", "API key is required.");
        }
        return settings.apiKey();
    }

    static String dataCenter(String apiKey) {
        int dash = apiKey.lastIndexOf('-');
        if (dash < 0 || dash == apiKey.length() - 1) {
            throw ProviderException.badRequest("bad_key", "Invalid Mailchimp API key format.");
        }
        return apiKey.substring(dash + 1);
    }

    private JsonNode fetch(String apiKey, String url, String failure) {
        log.debug("mailchimp GET url={} key={}", url, SecretMasker.mask(apiKey));
        try {
            JsonNode body = http.get()
                    .uri(url)
                    .header(HttpHeaders.AUTHORIZATION, "apikey " + apiKey)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw new ProviderException("http_error", failure, 502);
                    })
                    .body(JsonNode.class);
            return body == null ? json.createObjectNode() : body;
        } catch (RestClientException e) {
            log.warn("mailchimp request failed url={} key={}", url, SecretMasker.mask(apiKey), e);
            throw new ProviderException("http_error", failure, 502, e);
        }
    }

    private <T> List<T> cached(String key, TypeReference<List<T>> type, boolean refresh, Supplier<List<T>> loader) {
        if (!refresh) {
            Optional<List<T>> hit = cache.get(key).flatMap(raw -> decode(raw, type));
            if (hit.isPresent()) return hit.get();
        }

        List<T> fresh = loader.get();
        try {
            cache.put(key, json.writeValueAsString(fresh), properties.cacheTtl());
        } catch (JsonProcessingException e) {
            log.warn("could not cache mailchimp response key={}", key, e);
        }
        return fresh;
    }

    private <T> Optional<List<T>> decode(String raw, TypeReference<List<T>> type) {
        try {
            return Optional.of(json.readValue(raw, type));
        } catch (JsonProcessingException e) {
            log.warn("discarding unreadable cache entry", e);
            return Optional.empty();
        }
    }

    private static <T> List<T> collect(JsonNode array, Function<JsonNode, T> mapper) {
        List<T> items = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(n -> items.add(mapper.apply(n)));
        }
        return items;
    }

    private static String md5(String value) {
        return DigestUtils.md5DigestAsHex(value.getBytes(StandardCharsets.UTF_8));
    }

    public record Audience(String id, String name) {}

    public record Template(long id, String name) {}
}
