package com.docstore.rest;

import com.google.gson.Gson;
import io.javalin.json.JsonMapper;
import java.lang.reflect.Type;
import javax.annotation.Nonnull;

/** Javalin JSON mapper backed by Gson. */
public class GsonJsonMapper implements JsonMapper {

  private final Gson gson = new Gson();

  @Nonnull
  @Override
  public String toJsonString(@Nonnull Object obj, @Nonnull Type type) {
    return gson.toJson(obj, type);
  }

  @Nonnull
  @Override
  public <T> T fromJsonString(@Nonnull String json, @Nonnull Type targetType) {
    return gson.fromJson(json, targetType);
  }
}
