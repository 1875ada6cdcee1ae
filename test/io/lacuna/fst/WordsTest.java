package io.lacuna.fst;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

public class WordsTest {

  @Test
  public void testTokens() {
    Assert.assertEquals(Words.tokens("  a  b\tc "), Arrays.asList("a", "b", "c"));
    Assert.assertEquals(Words.tokens(""), Collections.emptyList());
    Assert.assertEquals(Words.length("0 1 1"), 3);
    Assert.assertEquals(Words.normalize(" a   b "), "a b");
  }

  @Test
  public void testConcat() {
    Assert.assertEquals(Words.concat("", "a"), "a");
    Assert.assertEquals(Words.concat("a", ""), "a");
    Assert.assertEquals(Words.concat("a b", "c"), "a b c");
  }

  @Test
  public void testLcpIsTokenWise() {
    Assert.assertEquals(Words.lcp("0 1 0", "0 1 1"), "0 1");
    Assert.assertEquals(Words.lcp("ab", "a"), "");
    Assert.assertEquals(Words.lcp(Arrays.asList("0 1", "0 1 1", "0 2")), "0");
    Assert.assertEquals(Words.lcp(Collections.<String>emptyList()), "");
  }

  @Test
  public void testPrefixes() {
    Assert.assertTrue(Words.isPrefix("", "a"));
    Assert.assertTrue(Words.isPrefix("0 1", "0 1 2"));
    Assert.assertFalse(Words.isPrefix("0 1 2", "0 1"));
    Assert.assertFalse(Words.isPrefix("a", "ab"));

    Assert.assertEquals(Words.removePrefix("0 1 2", "0 1"), "2");
    Assert.assertEquals(Words.removePrefix("0 1", ""), "0 1");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testRemovePrefixRejectsNonPrefix() {
    Words.removePrefix("0 1", "1");
  }
}
