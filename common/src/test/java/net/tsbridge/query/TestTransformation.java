// This file is part of tsbridge.
// Copyright (C) 2026  The tsbridge Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsbridge.query;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import net.tsbridge.exceptions.QueryValidationException;

public class TestTransformation {

  @Test
  public void rate() throws Exception {
    Transformation rate = Transformation.rate();
    assertEquals(TransformationType.RATE, rate.getType());
    assertNull(rate.getInterval());
    
    rate = Transformation.rate("5m");
    assertEquals("5m", rate.getInterval());
    
    try {
      Transformation.rate("5x");
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }
  }
  
  @Test
  public void math() throws Exception {
    final Transformation math = Transformation.math(MathOperator.MULTIPLY, 8);
    assertEquals(TransformationType.MATH, math.getType());
    assertEquals(MathOperator.MULTIPLY, math.getOperator());
    assertEquals(8, math.getOperand(), 0.001);
    assertEquals("8", math.getOperandString());
    
    try {
      Transformation.math(MathOperator.DIVIDE, 0);
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }
    
    try {
      Transformation.math(null, 1);
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }
    
    assertEquals(MathOperator.SUBTRACT, MathOperator.fromSymbol("-"));
  }
  
  @Test
  public void groupBy() throws Exception {
    final Transformation group = Transformation.groupBy("host", "dc");
    assertEquals(Arrays.asList("host", "dc"), group.getLabels());
    
    try {
      Transformation.groupBy(Collections.<String>emptyList());
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }
  }
}
