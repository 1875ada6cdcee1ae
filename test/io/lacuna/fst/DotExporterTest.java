package io.lacuna.fst;

import org.testng.Assert;
import org.testng.annotations.Test;

public class DotExporterTest {

  @Test
  public void testAcceptor() {
    String dot = DotExporter.toDot(Fsts.linearAcceptor("a"), FstConfig.of("a"));

    Assert.assertTrue(dot.startsWith("digraph G {\n"));
    Assert.assertTrue(dot.contains("  0 [style=bold label=\"0\"];\n"));
    Assert.assertTrue(dot.contains("  1 [shape=doublecircle label=\"1\"];\n"));
    Assert.assertFalse(dot.contains("⊥"));
    Assert.assertTrue(dot.contains("  0 -> 1 [label=\"a\"];\n"));
    Assert.assertTrue(dot.endsWith("}\n"));
  }

  @Test
  public void testTransducer() {
    Fst<String> fst = new FstBuilder<String>()
            .addStates("p", "q\"")
            .setInitial("p")
            .setFinal("q\"", "x")
            .addTransition("p", "a", "", "q\"")
            .build();
    String dot = DotExporter.toDot(fst, FstConfig.of("a"));

    Assert.assertTrue(dot.contains("  0 -> 1 [label=\"a:ϵ\"];\n"));
    Assert.assertTrue(dot.contains("label=\"q\\\"/x\""));
    Assert.assertTrue(dot.contains("  0 [style=bold label=\"p/⊥\"];\n"));
  }
}
