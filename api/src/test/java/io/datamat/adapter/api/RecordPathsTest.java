/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.datamat.adapter.api;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for RecordPaths.
 */
@Tag("unit")
public class RecordPathsTest {

  private static Map<String, Object> order() {
    Map<String, Object> contact = new LinkedHashMap<String, Object>();
    contact.put("id", 7);
    contact.put("nome", "Loja Centro");
    Map<String, Object> item = new LinkedHashMap<String, Object>();
    item.put("codigo", "SKU-1");

    Map<String, Object> order = new LinkedHashMap<String, Object>();
    order.put("id", 1001L);
    order.put("contato", contact);
    order.put("itens", Arrays.asList(item));
    order.put("loja.id", "flat");
    return order;
  }

  @Test void testNestedPath() {
    assertEquals(7, RecordPaths.get(order(), "contato.id"));
    assertEquals("Loja Centro", RecordPaths.get(order(), "contato.nome"));
  }

  @Test void testListContributesFirstElement() {
    assertEquals("SKU-1", RecordPaths.get(order(), "itens.codigo"));
  }

  @Test void testExactKeyWins() {
    assertEquals("flat", RecordPaths.get(order(), "loja.id"));
  }

  @Test void testMissingSegment() {
    assertNull(RecordPaths.get(order(), "contato.email"));
    assertNull(RecordPaths.get(order(), "id.valor"));
    assertNull(RecordPaths.get(Collections.<String, Object>emptyMap(), "id"));
  }

  @Test void testIdentityInStringForm() {
    assertEquals("1001", RecordPaths.identityOf(order(), "id"));
    assertEquals("7", RecordPaths.identityOf(order(), "contato.id"));
    assertNull(RecordPaths.identityOf(order(), "contato"));
    assertNull(RecordPaths.identityOf(order(), "itens"));
    assertNull(RecordPaths.identityOf(order(), "numero"));
  }
}
