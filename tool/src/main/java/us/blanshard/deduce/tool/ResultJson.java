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
package us.blanshard.deduce.tool;

import us.blanshard.deduce.core.Grid;
import us.blanshard.deduce.rules.Rule;
import us.blanshard.deduce.solve.Solver;

import com.google.common.collect.Multiset;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

/**
 * Converts grids and solver results to and from json.
 *
 * @author Luke Blanshard
 */
public class ResultJson {

  /** A convenience for writing results. */
  public static final Gson GSON = register(new GsonBuilder()).create();

  /**
   * Registers type adapters in the given builder so that grids and solver
   * results can be serialized.  Grids are also deserialized; results are
   * write-only.
   */
  public static GsonBuilder register(GsonBuilder builder) {
    final TypeAdapter<Grid> gridAdapter = new TypeAdapter<Grid>() {
      @Override public void write(JsonWriter out, Grid value) throws IOException {
        out.value(value.toFlatString());
      }
      @Override public Grid read(JsonReader in) throws IOException {
        return Grid.fromString(in.nextString());
      }
    };
    builder.registerTypeAdapter(Grid.class, gridAdapter);

    builder.registerTypeAdapter(Solver.Result.class, new TypeAdapter<Solver.Result>() {
      @Override public void write(JsonWriter out, Solver.Result value) throws IOException {
        out.beginObject();
        out.name("start");
        gridAdapter.write(out, value.start);
        out.name("outcome").value(value.outcome.name());
        out.name("numSolutions").value(value.numSolutions);
        out.name("solutions").beginArray();
        for (Grid solution : value.solutions)
          gridAdapter.write(out, solution);
        out.endArray();
        out.name("states").value(value.numStates);
        out.name("passes").value(value.numPasses);
        out.name("eliminations").beginObject();
        for (Multiset.Entry<Rule> entry : value.eliminations.entrySet())
          out.name(entry.getElement().displayName()).value(entry.getCount());
        out.endObject();
        out.endObject();
      }
      @Override public Solver.Result read(JsonReader in) throws IOException {
        throw new UnsupportedOperationException("Results can't be read back");
      }
    });

    return builder;
  }

  private ResultJson() {}
}
