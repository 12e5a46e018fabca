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
package us.blanshard.mines.core;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class GeometryTest {
  private final Geometry geometry = new Geometry(3, 4);

  @Test public void all() {
    assertEquals(12, geometry.size());
    assertEquals(12, geometry.all().size());
    for (int index = 0; index < geometry.size(); ++index) {
      Cell cell = geometry.all().get(index);
      assertEquals(index, geometry.index(cell));
      assertEquals(cell, geometry.cell(index));
    }
    assertEquals(Cell.of(1, 0), geometry.cell(4));
  }

  @Test public void contains() {
    assertTrue(geometry.contains(Cell.of(2, 3)));
    assertFalse(geometry.contains(Cell.of(3, 0)));
    assertFalse(geometry.contains(Cell.of(0, 4)));
  }

  @Test public void neighbors_interior() {
    assertThat(geometry.neighbors(Cell.of(1, 1))).containsExactly(
        Cell.of(0, 0), Cell.of(0, 1), Cell.of(0, 2),
        Cell.of(1, 0), Cell.of(1, 2),
        Cell.of(2, 0), Cell.of(2, 1), Cell.of(2, 2)).inOrder();
  }

  @Test public void neighbors_clipped() {
    assertThat(geometry.neighbors(Cell.of(0, 0)))
        .containsExactly(Cell.of(0, 1), Cell.of(1, 0), Cell.of(1, 1));
    assertThat(geometry.neighbors(Cell.of(2, 3)))
        .containsExactly(Cell.of(1, 2), Cell.of(1, 3), Cell.of(2, 2));
    assertThat(geometry.neighbors(Cell.of(0, 2))).hasSize(5);
  }

  @Test public void neighbors_single() {
    assertThat(new Geometry(1, 1).neighbors(Cell.of(0, 0))).isEmpty();
  }

  @Test public void equality() {
    assertEquals(new Geometry(3, 4), geometry);
    assertEquals(new Geometry(3, 4).hashCode(), geometry.hashCode());
    assertFalse(new Geometry(4, 3).equals(geometry));
    assertEquals("3x4", geometry.toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void neighbors_offBoard() {
    geometry.neighbors(Cell.of(3, 3));
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void cell_badIndex() {
    geometry.cell(12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void emptyBoard() {
    new Geometry(0, 5);
  }
}
