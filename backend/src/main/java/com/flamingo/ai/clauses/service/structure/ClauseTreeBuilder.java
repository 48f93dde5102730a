package com.flamingo.ai.clauses.service.structure;

import com.flamingo.ai.clauses.config.ExtractionSettings;
import com.flamingo.ai.clauses.service.layout.Line;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the clause forest from detected headings and the lines between them.
 *
 * <p>Headings are processed in document order. The first heading with a given identifier creates
 * the clause; later duplicates are ignored together with their body. A dotted clause is attached
 * to the clause whose identifier is its own minus the last segment. If that parent was never
 * detected (for instance because its heading missed the font threshold) the clause is kept as a
 * root. Roots are returned in numeric order; children stay in discovery order.
 *
 * <p>Nodes live in an arena indexed by insertion order and parents refer to children by index, so
 * the tree has no back references while it is being built. It is frozen into immutable {@link
 * Clause} records at the end of the pass.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClauseTreeBuilder {

  private final ExtractionSettings settings;
  private final NoiseFilter noiseFilter;
  private final TextReconstructor textReconstructor;

  public List<Clause> build(List<Line> lines, List<Heading> headings) {
    List<Node> arena = new ArrayList<>();
    Map<String, Integer> indexById = new HashMap<>();
    List<Integer> roots = new ArrayList<>();

    for (int h = 0; h < headings.size(); h++) {
      Heading heading = headings.get(h);
      String id = heading.identifier().value();
      if (indexById.containsKey(id)) {
        log.debug("Ignoring duplicate heading {} at line {}", id, heading.startLineIndex());
        continue;
      }
      Node node = new Node(heading);
      int index = arena.size();
      arena.add(node);
      indexById.put(id, index);

      Optional<ClauseIdentifier> parentId = heading.identifier().parent();
      Integer parentIndex = parentId.map(p -> indexById.get(p.value())).orElse(null);
      if (parentIndex != null) {
        arena.get(parentIndex).children.add(index);
      } else {
        if (parentId.isPresent()) {
          log.debug(
              "Parent {} of clause {} not detected, keeping it as a root", parentId.get(), id);
        }
        roots.add(index);
      }

      int end = h + 1 < headings.size() ? headings.get(h + 1).startLineIndex() : lines.size();
      collectBody(node, lines, heading.endLineIndex(), end);
    }

    return roots.stream()
        .map(arena::get)
        .filter(node -> isWellFormed(node.heading.identifier().value()))
        .sorted(Comparator.comparing(node -> node.heading.identifier()))
        .map(node -> freeze(node, arena))
        .toList();
  }

  private void collectBody(Node node, List<Line> lines, int start, int end) {
    Line previous = null;
    for (int i = start; i < end; i++) {
      Line line = lines.get(i);
      String text = line.cleanedText();
      if (noiseFilter.shouldSkip(text)
          || HeadingDetector.matchesHeadingNumber(text)
          || noiseFilter.looksLikeFragment(line, text)) {
        continue;
      }
      if (previous != null && startsNewBlock(previous, line)) {
        node.bodyLines.add("");
      }
      node.bodyLines.add(text);
      previous = line;
    }
  }

  private boolean startsNewBlock(Line previous, Line line) {
    return line.page() != previous.page() || line.top() - previous.top() > settings.paragraphGap();
  }

  /** Dot-free, or exactly one dot between each pair of segments. */
  static boolean isWellFormed(String identifier) {
    if (!identifier.contains(".")) {
      return true;
    }
    long dots = identifier.chars().filter(c -> c == '.').count();
    return dots == identifier.split("\\.", -1).length - 1;
  }

  private Clause freeze(Node node, List<Node> arena) {
    List<Clause> children =
        node.children.stream().map(arena::get).map(child -> freeze(child, arena)).toList();
    return new Clause(
        node.heading.identifier(),
        node.heading.title(),
        node.bodyLines,
        textReconstructor.reconstruct(node.bodyLines),
        children);
  }

  private static final class Node {
    private final Heading heading;
    private final List<String> bodyLines = new ArrayList<>();
    private final List<Integer> children = new ArrayList<>();

    Node(Heading heading) {
      this.heading = heading;
    }
  }
}
