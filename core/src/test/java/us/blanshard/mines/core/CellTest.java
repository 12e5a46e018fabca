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
import static org.junit.Assert.assertNotEquals;

import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;

import org.junit.Test;

public class CellTest {

  @Test public void equality() {
    assertEquals(Cell.of(2, 3), Cell.of(2, 3));
    assertEquals(Cell.of(2, 3).hashCode(), Cell.of(2, 3).hashCode());
    assertNotEquals(Cell.of(2, 3), Cell.of(3, 2));
    assertEquals("(2, 3)", Cell.of(2, 3).toString());
  }

  @Test public void rowMajorOrder() {
    List<Cell> cells = Lists.newArrayList(Cell.of(1, 0), Cell.of(0, 5), Cell.of(1, 1), Cell.of(0, 0));
    Collections.sort(cells);
    assertThat(cells).containsExactly(Cell.of(0, 0), Cell.of(0, 5), Cell.of(1, 0), Cell.of(1, 1))
        .inOrder();
    assertEquals(0, Cell.of(4, 4).compareTo(Cell.of(4, 4)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void negativeRow() {
    Cell.of(-1, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void negativeColumn() {
    Cell.of(0, -1);
  }
}
