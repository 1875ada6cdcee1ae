package io.lacuna.fst.ostia;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.TreeSet;

public class SampleTest {

  static Sample load(String resource) throws IOException {
    try (Reader reader = new InputStreamReader(
            SampleTest.class.getClassLoader().getResourceAsStream(resource), StandardCharsets.UTF_8)) {
      return Sample.read(reader);
    }
  }

  @Test
  public void testRead() throws IOException {
    Sample sample = load("ostia/sample.tsv");

    Assert.assertEquals(sample.size(), 6);
    Assert.assertEquals(sample.examples().first(), new Sample.Example("a", "1"));
    Assert.assertEquals(sample.examples().last(), new Sample.Example("a b a b", "0 1 0 1"));
    Assert.assertEquals(sample.inputAlphabet(), new TreeSet<>(Arrays.asList("a", "b")));
    Assert.assertEquals(sample.outputAlphabet(), new TreeSet<>(Arrays.asList("0", "1")));
  }

  @Test
  public void testReadEmptyOutput() throws IOException {
    Sample sample = Sample.read(new StringReader("a b\t\n"));
    Assert.assertEquals(sample.examples().first().output(), "");
  }

  @Test
  public void testReadReportsLineNumber() throws IOException {
    try {
      load("ostia/malformed.tsv");
      Assert.fail();
    } catch (IllegalArgumentException e) {
      Assert.assertTrue(e.getMessage().startsWith("line 2:"), e.getMessage());
    }
  }

  @Test
  public void testDuplicatesCollapse() {
    Sample sample = Sample.builder()
            .add("a  a", "0 1")
            .add("a a", "0   1")
            .add("b", "")
            .build();

    Assert.assertEquals(sample.size(), 2);
    Assert.assertEquals(sample.examples().first().input(), "a a");
  }

  @Test
  public void testInconsistent() {
    try {
      Sample.builder().add("a", "0").add("a", "1");
      Assert.fail();
    } catch (InconsistentSampleException e) {
      Assert.assertEquals(e.input(), "a");
      Assert.assertEquals(e.firstOutput(), "0");
      Assert.assertEquals(e.secondOutput(), "1");
    }
  }

  @Test(expectedExceptions = InconsistentSampleException.class)
  public void testReadInconsistent() throws IOException {
    Sample.read(new StringReader("a\t0\n# comment\na\t1\n"));
  }
}
