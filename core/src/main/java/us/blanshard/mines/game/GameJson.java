/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.mines.game;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.reflect.TypeToken;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.List;

/**
 * Static methods that convert mines game histories to and from json.  Each
 * move is written as a compact string, "row,col,kind,count".
 *
 * @author Luke Blanshard
 */
public class GameJson {
  public static final Splitter SPLITTER = Splitter.on(',');
  public static final Joiner JOINER = Joiner.on(',');

  /** A Type to use with {@link Gson} for game histories. */
  @SuppressWarnings("serial")
  public static final Type HISTORY_TYPE = new TypeToken<List<Move>>(){}.getType();

  /** A convenience for reading/writing history. */
  public static final Gson HISTORY_GSON = registerHistory(new GsonBuilder()).create();

  /**
   * Registers type adapters in the given builder so that history lists can be
   * serialized and deserialized.
   */
  public static GsonBuilder registerHistory(GsonBuilder builder) {
    builder.registerTypeHierarchyAdapter(Move.class, new TypeAdapter<Move>() {
      @Override public void write(JsonWriter out, Move value) throws IOException {
        out.value(value.toJsonValue());
      }
      @Override public Move read(JsonReader in) throws IOException {
        return Move.fromJsonValue(in.nextString());
      }
    });
    return builder;
  }

  /** Renders the given history as a json array. */
  public static String toJson(List<Move> history) {
    return HISTORY_GSON.toJson(history, HISTORY_TYPE);
  }

  /** Parses a json array written by {@link #toJson}. */
  public static List<Move> fromJson(String json) {
    return HISTORY_GSON.fromJson(json, HISTORY_TYPE);
  }

  // Static methods only.
  private GameJson() {}
}
