/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.mct.frontend.tree;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import exm.mct.common.exceptions.MCTRuntimeError;

/**
 * JSON exchange format for the tree.  Each node is an object with a "type"
 * field naming its kind and one field per attribute.  Source positions are
 * not exported.
 */
public class TreeJson {

  private static final ObjectMapper mapper = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT)
      .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

  public static String toJson(Program program) {
    try {
      return mapper.writeValueAsString(program);
    } catch (JsonProcessingException e) {
      throw new MCTRuntimeError("Could not serialize tree", e);
    }
  }

  /**
   * @throws IOException if the text is not a valid exported tree
   */
  public static Program fromJson(String json) throws IOException {
    Node node = mapper.readValue(json, Node.class);
    if (node == null) {
      throw new IOException("Expected a Program at the root but found null");
    } else if (!(node instanceof Program)) {
      throw new IOException("Expected a Program at the root but found " +
                            node.getKind());
    }
    return (Program) node;
  }
}
