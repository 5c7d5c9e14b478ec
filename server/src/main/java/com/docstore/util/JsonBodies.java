package com.docstore.util;

import com.docstore.common.status.Status;
import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import java.io.IOException;
import java.io.StringReader;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * Validation of request bodies. A body is accepted when it is exactly one strict JSON value that a
 * {@code JSONB} column can hold; the text is then stored as received.
 *
 * <p>{@code JSONB} refuses two things that are valid JSON: the NUL character U+0000 and unpaired
 * UTF-16 surrogates such as U+D800. Both are rejected here, in keys and in values.
 */
public final class JsonBodies {

  private static final TypeAdapter<JsonElement> ELEMENT_ADAPTER =
      new Gson().getAdapter(JsonElement.class);

  private JsonBodies() {
    // Utility class, no instances
  }

  /**
   * Checks that {@code body} is present and is a single JSON value.
   *
   * @return OK, or an INVALID_BODY status describing the problem
   */
  @Nonnull
  public static Status validate(String body) {
    if (Strings.isNullOrEmpty(body) || body.isBlank()) {
      return Status.invalidBody("Request body must be a JSON document");
    }
    try (JsonReader reader = new JsonReader(new StringReader(body))) {
      reader.setStrictness(Strictness.STRICT);
      JsonElement document = ELEMENT_ADAPTER.read(reader);
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        return Status.invalidBody("Request body must contain a single JSON value");
      }
      return checkStorable(document);
    } catch (IOException | JsonParseException | IllegalStateException e) {
      return Status.invalidBody("Malformed JSON: " + e.getMessage());
    }
  }

  private static Status checkStorable(JsonElement element) {
    if (element.isJsonObject()) {
      for (Map.Entry<String, JsonElement> member : element.getAsJsonObject().entrySet()) {
        Status keyStatus = checkStorable(member.getKey());
        if (keyStatus.isError()) {
          return keyStatus;
        }
        Status valueStatus = checkStorable(member.getValue());
        if (valueStatus.isError()) {
          return valueStatus;
        }
      }
    } else if (element.isJsonArray()) {
      for (JsonElement item : element.getAsJsonArray()) {
        Status itemStatus = checkStorable(item);
        if (itemStatus.isError()) {
          return itemStatus;
        }
      }
    } else if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
      return checkStorable(element.getAsString());
    }
    return Status.ok();
  }

  private static Status checkStorable(String text) {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\0') {
        return Status.invalidBody("Strings must not contain the NUL character U+0000");
      }
      if (Character.isHighSurrogate(c)
          && i + 1 < text.length()
          && Character.isLowSurrogate(text.charAt(i + 1))) {
        i++;
      } else if (Character.isSurrogate(c)) {
        return Status.invalidBody(
            "Strings must not contain unpaired surrogate U+"
                + Integer.toHexString(c).toUpperCase(Locale.ROOT));
      }
    }
    return Status.ok();
  }
}
