package edu.jhu.hlt.depparse.data;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.jhu.hlt.depparse.datatypes.DependencySentence;
import edu.jhu.hlt.depparse.datatypes.Token;

public class ConllReaderTest {

  public static final String SAMPLE = "sample.conllu";

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  public static List<DependencySentence> sample() throws IOException {
    try (InputStream is = ConllReaderTest.class.getResourceAsStream(SAMPLE);
        Reader r = new InputStreamReader(is, StandardCharsets.UTF_8)) {
      return ConllReader.read(r, SAMPLE);
    }
  }

  @Test
  public void readsSample() throws IOException {
    List<DependencySentence> sents = sample();
    assertEquals(3, sents.size());
    assertEquals("test-s1", sents.get(0).getId());
    assertEquals("test-s2", sents.get(1).getId());
    assertEquals("test-s3", sents.get(2).getId());

    DependencySentence s1 = sents.get(0);
    assertEquals(11, s1.size());
    assertEquals("然而", s1.getToken(1).form);
    assertEquals(7, s1.getHead(1));
    assertEquals(0, s1.getHead(7));
    assertTrue(s1.isProjective());

    assertEquals(9, sents.get(1).size());
    assertFalse(sents.get(1).isProjective());
  }

  @Test
  public void multiwordRangesAndEmptyNodesAreDropped() throws IOException {
    DependencySentence s3 = sample().get(2);
    assertEquals(6, s3.size());
    assertEquals("Vamos", s3.getToken(1).form);
    assertEquals("mar", s3.getToken(5).form);
    assertEquals(".", s3.getToken(6).form);
    int[] heads = new int[6];
    for (int i = 0; i < 6; i++)
      heads[i] = s3.getHead(i + 1);
    assertArrayEquals(new int[] {0, 1, 5, 5, 1, 1}, heads);
    assertTrue(s3.isProjective());
  }

  @Test
  public void defaultIdsAndMissingHeads() {
    String conll = "1\tthe\t_\t_\t_\t_\t2\n"
        + "2\tdog\t_\t_\t_\t_\t0\n"
        + "\n\n"
        + "1\tyes\t_\t_\t_\t_\t_\n";
    List<DependencySentence> sents = ConllReader.readString(conll);
    assertEquals(2, sents.size());
    assertEquals("string-0", sents.get(0).getId());
    assertEquals("string-1", sents.get(1).getId());
    assertEquals(Token.NO_HEAD, sents.get(1).getHead(1));
    assertFalse(sents.get(1).hasAllHeads());
  }

  @Test
  public void spaceSeparated() {
    List<DependencySentence> sents = ConllReader.readString("1 a _ _ _ _ 0\n2 b _ _ _ _ 1");
    assertEquals(1, sents.size());
    assertEquals(1, sents.get(0).getHead(2));
  }

  @Test
  public void emptyInput() {
    assertTrue(ConllReader.readString("").isEmpty());
    assertTrue(ConllReader.readString("\n# just a comment\n\n").isEmpty());
  }

  @Test
  public void malformedLine() {
    try {
      ConllReader.readString("# sent_id = x\n1\ta\t_\n");
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("string:2"));
    }
  }

  @Test
  public void invalidTreeReportsWhereTheSentenceStarts() {
    String conll = "1\ta\t_\t_\t_\t_\t0\n"
        + "\n\n"
        + "# sent_id = bad\n"
        + "1\ta\t_\t_\t_\t_\t0\n"
        + "2\tb\t_\t_\t_\t_\t5\n";
    try {
      ConllReader.readString(conll);
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("string:4 "));
      assertTrue(e.getMessage(), e.getMessage().contains("bad"));
      assertTrue(e.getCause() instanceof IllegalArgumentException);
    }
  }

  @Test
  public void selfHeadReportsLine() {
    try {
      ConllReader.readString("1\ta\t_\t_\t_\t_\t1\n");
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("string:1 "));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void badHead() {
    ConllReader.readString("1\ta\t_\t_\t_\t_\tROOT\n");
  }

  @Test
  public void parseLine() {
    assertNull(ConllReader.parseLine("3-4\tal\t_\t_\t_\t_\t_\t_\t_\t_", "f", 1));
    assertNull(ConllReader.parseLine("5.1\tfue\t_\t_\t_\t_\t_\t_\t_\t_", "f", 1));
    assertEquals(new Token(2, "nos", 1), ConllReader.parseLine("2\tnos\tnosotros\tPRON\t_\t_\t1\tobj\t_\t_", "f", 1));
  }

  @Test
  public void readFile() throws IOException {
    File f = tmp.newFile("two.conllu");
    Files.write(f.toPath(), Arrays.asList("# sent_id = a", "1\tx\t_\t_\t_\t_\t0", ""),
        StandardCharsets.UTF_8);
    List<DependencySentence> sents = ConllReader.read(f);
    assertEquals(1, sents.size());
    assertEquals("a", sents.get(0).getId());
  }
}
