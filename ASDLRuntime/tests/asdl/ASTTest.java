package asdl;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class ASTTest {

  @Test
  public void valuesCanBeReassignedAndRemoved() {
    Nodes.Num num = new Nodes.Num(4);
    assertThat(num.getValue("n")).hasValue(4);

    num.setValue("n", 7);
    assertThat(num.n()).isEqualTo(7);

    num.removeValue("n");
    assertThat(num.hasValue("n")).isFalse();
    assertThat(num.getValue("n")).isEmpty();
    IllegalStateException ex = assertThrows(IllegalStateException.class, num::n);
    assertThat(ex).hasMessageThat().contains("'n'");
  }

  @Test
  public void nullValueMeansAbsent() {
    Nodes.Name name = new Nodes.Name("x");
    name.setValue("id", null);
    assertThat(name.hasValue("id")).isFalse();
  }

  @Test
  public void missingListReadsAsEmpty() {
    Nodes.Block block = new Nodes.Block("b");
    block.removeValue("body");
    assertThat(block.body()).isEmpty();
  }

  @Test
  public void locationStartsUnset() {
    Nodes.Pass pass = new Nodes.Pass();
    assertThat(pass.hasLocation()).isFalse();
    assertThat(pass.startLine()).isEmpty();
    assertThat(pass.symref()).isEmpty();

    Nodes.located(pass, 1, 2, 3, 4);
    assertThat(pass.hasLocation()).isTrue();

    pass.clearStartColumn();
    assertThat(pass.hasLocation()).isFalse();
    assertThat(pass.startLine()).hasValue(1);
  }

  @Test
  public void symrefIsOpaque() {
    Object symbol = new Object();
    Nodes.Name name = new Nodes.Name("x");
    name.setSymref(symbol);
    assertThat(name.symref()).hasValue(symbol);
  }

  @Test
  public void toStringListsSetValues() {
    Nodes.Print print = new Nodes.Print(new Nodes.Num(3));
    print.setValue("label", "top");
    assertThat(print.toString()).isEqualTo("Print(label=top, value=Num(n=3))");
  }
}
