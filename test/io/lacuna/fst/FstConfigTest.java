package io.lacuna.fst;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.Properties;
import java.util.TreeSet;

public class FstConfigTest {

  @Test
  public void testDefaults() {
    FstConfig config = FstConfig.of("b", "a");

    Assert.assertEquals(config.sigma(), new TreeSet<>(Arrays.asList("a", "b")));
    Assert.assertTrue(config.lambda().isEmpty());
    Assert.assertEquals(config.beginMarker(), FstConfig.DEFAULT_BEGIN);
    Assert.assertEquals(config.endMarker(), FstConfig.DEFAULT_END);
    Assert.assertEquals(config.epsilon(), FstConfig.DEFAULT_EPSILON);
    Assert.assertEquals(config.unknown(), FstConfig.DEFAULT_UNKNOWN);
    Assert.assertEquals(config.boundary(), FstConfig.DEFAULT_BOUNDARY);
  }

  @Test
  public void testLoad() throws IOException {
    FstConfig config = FstConfig.load("fst.properties");

    Assert.assertEquals(config.sigma(), new TreeSet<>(Arrays.asList("a", "b", "c")));
    Assert.assertEquals(config.lambda(), new TreeSet<>(Arrays.asList("0", "1")));
    Assert.assertEquals(config.beginMarker(), "<");
    Assert.assertEquals(config.endMarker(), ">");
    Assert.assertEquals(config.epsilon(), FstConfig.DEFAULT_EPSILON);
  }

  @Test(expectedExceptions = IOException.class)
  public void testLoadMissingResource() throws IOException {
    FstConfig.load("missing.properties");
  }

  @Test
  public void testFromEmptyProperties() {
    Assert.assertEquals(FstConfig.fromProperties(new Properties()), FstConfig.builder().build());
  }

  @Test
  public void testToBuilder() {
    FstConfig config = FstConfig.builder().sigma("a").lambda("0").endMarker("#").build();
    Assert.assertEquals(config.toBuilder().build(), config);
    Assert.assertEquals(config.toBuilder().sigma("b").build().sigma().size(), 2);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testRejectsReservedSymbolInAlphabet() {
    FstConfig.of("a", FstConfig.DEFAULT_END);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testRejectsCollidingMarkers() {
    FstConfig.builder().beginMarker("#").endMarker("#").build();
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testRejectsWhitespaceInSymbols() {
    FstConfig.of("a b");
  }
}
