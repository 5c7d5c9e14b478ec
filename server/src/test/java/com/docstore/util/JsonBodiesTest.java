package com.docstore.util;

import static org.junit.jupiter.api.Assertions.*;

import com.docstore.common.status.StatusCode;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class JsonBodiesTest {

  @ParameterizedTest
  @ValueSource(
      strings = {
        "{\"title\":\"Alien\"}",
        "{\"title\":\"Alien\",\"cast\":[{\"name\":\"Sigourney Weaver\"}],\"year\":1979}",
        "[1,2,3]",
        "\"just a string\"",
        "42",
        "  {\"padded\": true}  ",
        "{\"emoji\":\"\\ud83c\\udfac\"}"
      })
  void testAcceptsJsonValues(String body) {
    assertTrue(JsonBodies.validate(body).isOk(), body);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(
      strings = {
        "   ",
        "{\"title\":",
        "title=Alien",
        "{'title':'Alien'}",
        "{\"a\":1} {\"b\":2}",
        "{\"a\":NaN}"
      })
  void testRejectsEverythingElse(String body) {
    assertEquals(StatusCode.INVALID_BODY, JsonBodies.validate(body).getCode());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "{\"a\":\"\\u0000\"}",
        "{\"a\":\"\\ud800\"}",
        "{\"a\":\"x\\udc00y\"}",
        "{\"\\ud800\":1}",
        "[1,[\"ok\",\"\\ud83c\"]]",
        "\"tail\\u0000\""
      })
  void testRejectsStringsJsonbCannotStore(String body) {
    assertEquals(StatusCode.INVALID_BODY, JsonBodies.validate(body).getCode(), body);
  }
}
