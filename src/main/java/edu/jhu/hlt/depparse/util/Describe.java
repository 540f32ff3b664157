package edu.jhu.hlt.depparse.util;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import edu.jhu.hlt.depparse.datatypes.Arc;
import edu.jhu.hlt.depparse.datatypes.DependencySentence;
import edu.jhu.hlt.depparse.datatypes.Token;
import edu.jhu.hlt.depparse.transition.Configuration;

/**
 * Human readable renderings of sentences and parser states. Nothing here
 * prints; callers decide where the strings go.
 */
public class Describe {

  /** e.g. "The/1<-2 dog/2<-3 barked/3<-0" */
  public static String sentenceWithHeads(DependencySentence sent) {
    List<String> items = new ArrayList<>(sent.size());
    for (Token t : sent.getTokens()) {
      String h = t.hasHead() ? String.valueOf(t.head) : "_";
      items.add(t.form + "/" + t.id + "<-" + h);
    }
    return StringUtils.join(items, ' ');
  }

  /** Stack and buffer as words, e.g. "[ROOT dog | barked .]" */
  public static String stackAndBuffer(Configuration c) {
    StringBuilder sb = new StringBuilder("[");
    sb.append(StringUtils.join(forms(c, c.getStack()), ' '));
    sb.append(" |");
    for (String w : forms(c, c.getBuffer()))
      sb.append(' ').append(w);
    sb.append(']');
    return sb.toString();
  }

  /** One field per line, for debugging and test failure messages */
  public static String configuration(Configuration c) {
    StringBuilder sb = new StringBuilder();
    sb.append("Configuration(").append(c.getSentenceId()).append(")\n");
    sb.append("  stack:       ").append(forms(c, c.getStack())).append('\n');
    sb.append("  buffer:      ").append(forms(c, c.getBuffer())).append('\n');
    sb.append("  arcs:        ").append(arcs(c)).append('\n');
    sb.append("  transitions: ").append(c.getTransitions()).append('\n');
    sb.append("  position:    ").append(c.getPosition()).append('\n');
    sb.append("  gold:        ").append(c.hasGold()
        ? sentenceWithHeads(c.getGold().getTree()) : "none");
    return sb.toString();
  }

  private static List<String> forms(Configuration c, List<Integer> ids) {
    List<String> f = new ArrayList<>(ids.size());
    for (int id : ids)
      f.add(c.getWord(id).form);
    return f;
  }

  private static List<String> arcs(Configuration c) {
    List<String> f = new ArrayList<>();
    for (Arc a : c.getArcs())
      f.add(c.getWord(a.head).form + "->" + c.getWord(a.dependent).form);
    return f;
  }
}
