/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.source;

import org.torproject.metrics.recordmirror.downloader.BoundedRetry;
import org.torproject.metrics.recordmirror.downloader.Downloader;
import org.torproject.metrics.recordmirror.store.CachedRecord;
import org.torproject.metrics.recordmirror.store.TableInfo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Client for a REST/JSON record source that exposes table metadata at
 * {@code /v0/meta/bases/{baseId}/tables} and paginated records at
 * {@code /v0/{baseId}/{table}}.
 */
public class HttpSourceClient implements SourceClient {

  private static final Logger logger = LoggerFactory.getLogger(
      HttpSourceClient.class);

  /** Record identifiers per filter query, which keeps URLs short. */
  static final int MAX_IDS_PER_QUERY = 50;

  private static final TypeReference<Map<String, Object>> FIELDS_TYPE =
      new TypeReference<Map<String, Object>>() {};

  private static ObjectMapper objectMapper = new ObjectMapper();

  /** Performs a single authenticated GET request. */
  @FunctionalInterface
  public interface HttpFetcher {

    /** Returns the response body, or {@code null} on a non-200 status. */
    byte[] fetch(URL url, Map<String, String> headers) throws IOException;
  }

  private final String baseUrl;

  private final String baseId;

  private final Map<String, String> headers;

  private final BoundedRetry retry;

  private final HttpFetcher fetcher;

  /** Creates a client that downloads with {@link Downloader}. */
  public HttpSourceClient(URL baseUrl, String baseId, String token,
      BoundedRetry retry) {
    this(baseUrl, baseId, token, retry, Downloader::downloadFromHttpServer);
  }

  /** Creates a client using the given fetcher for all requests. */
  public HttpSourceClient(URL baseUrl, String baseId, String token,
      BoundedRetry retry, HttpFetcher fetcher) {
    String base = baseUrl.toString();
    this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1)
        : base;
    this.baseId = baseId;
    this.headers = Collections.singletonMap("Authorization",
        "Bearer " + token);
    this.retry = retry;
    this.fetcher = fetcher;
  }

  @Override
  public List<TableInfo> fetchTables() throws SourceException {
    URL url = this.url("/v0/meta/bases/" + encode(this.baseId) + "/tables");
    JsonNode response = this.get(url);
    List<TableInfo> tables = new ArrayList<>();
    for (JsonNode table : response.path("tables")) {
      String id = table.path("id").asText(null);
      String name = table.path("name").asText(null);
      if (null == id || null == name) {
        logger.warn("Skipping table without id or name in response from {}.",
            url);
        continue;
      }
      tables.add(TableInfo.of(id, name));
    }
    logger.debug("Fetched {} table(s) from source.", tables.size());
    return tables;
  }

  @Override
  public List<CachedRecord> fetchAllRecords(TableInfo table)
      throws SourceException {
    return this.fetchPages(table, null);
  }

  @Override
  public List<CachedRecord> fetchRecords(TableInfo table,
      Collection<String> ids) throws SourceException {
    List<CachedRecord> records = new ArrayList<>();
    List<String> chunk = new ArrayList<>();
    for (String id : ids) {
      chunk.add(id);
      if (chunk.size() == MAX_IDS_PER_QUERY) {
        records.addAll(this.fetchPages(table, formula(chunk)));
        chunk.clear();
      }
    }
    if (!chunk.isEmpty()) {
      records.addAll(this.fetchPages(table, formula(chunk)));
    }
    return records;
  }

  /** Builds a formula matching any of the given record identifiers. */
  static String formula(List<String> ids) {
    StringBuilder sb = new StringBuilder("OR(");
    for (int i = 0; i < ids.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append("RECORD_ID()=\"")
          .append(ids.get(i).replace("\\", "\\\\").replace("\"", "\\\""))
          .append('"');
    }
    return sb.append(')').toString();
  }

  private List<CachedRecord> fetchPages(TableInfo table, String formula)
      throws SourceException {
    List<CachedRecord> records = new ArrayList<>();
    String offset = null;
    do {
      StringBuilder query = new StringBuilder();
      if (null != formula) {
        query.append("filterByFormula=").append(encode(formula));
      }
      if (null != offset) {
        query.append(query.length() > 0 ? "&" : "").append("offset=")
            .append(encode(offset));
      }
      URL url = this.url("/v0/" + encode(this.baseId) + "/"
          + encode(table.getExternalId())
          + (query.length() > 0 ? "?" + query : ""));
      JsonNode response = this.get(url);
      for (JsonNode record : response.path("records")) {
        String id = record.path("id").asText(null);
        records.add(new CachedRecord(id, this.fields(table, id, record)));
      }
      offset = response.path("offset").asText(null);
    } while (null != offset && !offset.isEmpty());
    logger.debug("Fetched {} record(s) of table {}.", records.size(),
        table.getDisplayName());
    return records;
  }

  /** Returns null for absent or malformed fields, which the store rejects. */
  private Map<String, Object> fields(TableInfo table, String id,
      JsonNode record) {
    JsonNode fields = record.get("fields");
    if (null == fields || !fields.isObject()) {
      if (null != fields) {
        logger.warn("Record {} of table {} has malformed fields.", id,
            table.getDisplayName());
      }
      return null;
    }
    try {
      return objectMapper.convertValue(fields, FIELDS_TYPE);
    } catch (IllegalArgumentException e) {
      logger.warn("Cannot convert fields of record {} of table {}: {}", id,
          table.getDisplayName(), e.getMessage());
      return null;
    }
  }

  private JsonNode get(URL url) throws SourceException {
    return this.retry.run("fetch " + url, () -> {
      try {
        byte[] body = this.fetcher.fetch(url, this.headers);
        if (null == body) {
          throw new SourceException("Unexpected response status for " + url
              + ".");
        }
        return objectMapper.readTree(body);
      } catch (IOException e) {
        throw new SourceException("Cannot fetch " + url + ": "
            + e.getMessage(), e);
      }
    });
  }

  private URL url(String path) throws SourceException {
    try {
      return new URL(this.baseUrl + path);
    } catch (MalformedURLException e) {
      throw new SourceException("Invalid source URL " + this.baseUrl + path
          + ".", e);
    }
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8)
        .replace("+", "%20");
  }
}
