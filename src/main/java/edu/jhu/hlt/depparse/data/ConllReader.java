package edu.jhu.hlt.depparse.data;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import edu.jhu.hlt.depparse.datatypes.DependencySentence;
import edu.jhu.hlt.depparse.datatypes.Token;

/**
 * Reads CoNLL-U (and CoNLL-X) dependency trees: one token per line, blank lines
 * between sentences.
 *
 * http://universaldependencies.org/format.html
 * 1  ID     Word index, integer starting at 1 for each new sentence; may be a
 *           range for multiword tokens; may be a decimal number for empty nodes.
 * 2  FORM   Word form or punctuation symbol.
 * ...
 * 7  HEAD   Head of the current word, which is either a value of ID or zero (0).
 *
 * Multiword token ranges and empty nodes have no single head, so they are
 * dropped. Only ID, FORM, and HEAD are kept.
 */
public class ConllReader {
  public static final Logger LOG = Logger.getLogger(ConllReader.class);

  public static final String SENT_ID_PREFIX = "# sent_id =";

  private static final int ID = 0;
  private static final int FORM = 1;
  private static final int HEAD = 6;

  public static List<DependencySentence> read(File f) throws IOException {
    LOG.info("reading " + f.getPath());
    try (BufferedReader r = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8)) {
      return read(r, f.getName());
    }
  }

  public static List<DependencySentence> readString(String conll) {
    try {
      return read(new StringReader(conll), "string");
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  /**
   * @param source used to make default sentence ids ("source-3") for sentences
   * without a sent_id comment
   */
  public static List<DependencySentence> read(Reader reader, String source) throws IOException {
    BufferedReader r = reader instanceof BufferedReader
        ? (BufferedReader) reader : new BufferedReader(reader);
    List<DependencySentence> sentences = new ArrayList<>();
    List<Token> tokens = new ArrayList<>();
    String sentId = null;
    int lineNum = 0;
    int firstLine = 0;   // 0 until the current sentence has a line
    for (String line = r.readLine(); line != null; line = r.readLine()) {
      lineNum++;
      String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        if (!tokens.isEmpty())
          sentences.add(sentence(sentId, source, firstLine, sentences.size(), tokens));
        tokens = new ArrayList<>();
        sentId = null;
        firstLine = 0;
        continue;
      }
      if (firstLine == 0)
        firstLine = lineNum;
      if (trimmed.startsWith("#")) {
        if (trimmed.startsWith(SENT_ID_PREFIX))
          sentId = trimmed.substring(SENT_ID_PREFIX.length()).trim();
      } else {
        Token t = parseLine(trimmed, source, lineNum);
        if (t != null)
          tokens.add(t);
      }
    }
    if (!tokens.isEmpty())
      sentences.add(sentence(sentId, source, firstLine, sentences.size(), tokens));
    return sentences;
  }

  /** Returns null for multiword token ranges and empty nodes */
  static Token parseLine(String line, String source, int lineNum) {
    String[] cols = line.indexOf('\t') >= 0
        ? StringUtils.splitPreserveAllTokens(line, '\t')
        : StringUtils.split(line);
    if (cols.length <= HEAD)
      throw new IllegalArgumentException(source + ":" + lineNum + " expected at least "
          + (HEAD + 1) + " columns but found " + cols.length + ": " + line);
    String id = cols[ID].trim();
    if (id.contains("-") || id.contains("."))
      return null;
    try {
      int i = Integer.parseInt(id);
      String h = cols[HEAD].trim();
      int head = "_".equals(h) || h.isEmpty() ? Token.NO_HEAD : Integer.parseInt(h);
      return new Token(i, cols[FORM].trim(), head);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(source + ":" + lineNum + " bad ID or HEAD: " + line, e);
    }
  }

  /** @param firstLine where the sentence (including its comments) starts */
  private static DependencySentence sentence(String sentId, String source, int firstLine,
      int index, List<Token> tokens) {
    String id = sentId != null ? sentId : source + "-" + index;
    try {
      return new DependencySentence(id, tokens);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(source + ":" + firstLine + " " + e.getMessage(), e);
    }
  }
}
