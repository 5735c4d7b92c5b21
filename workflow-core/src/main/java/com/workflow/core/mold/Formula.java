package com.workflow.core.mold;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed model formula of the form {@code outcome ~ term + term}.
 * Terms are column names, {@code .}, or {@code fn(column)} with a {@link TermFunction}.
 */
public final class Formula {
  private static final Pattern NAME = Pattern.compile("[A-Za-z.][A-Za-z0-9._]*");
  private static final Pattern CALL = Pattern.compile("([A-Za-z_]+)\\(\\s*([A-Za-z.][A-Za-z0-9._]*)\\s*\\)");

  private final String source;
  private final List<String> outcomes;
  private final List<Term> terms;

  private Formula(String source, List<String> outcomes, List<Term> terms) {
    this.source = source;
    this.outcomes = List.copyOf(outcomes);
    this.terms = List.copyOf(terms);
  }

  public static Formula parse(String text) {
    Objects.requireNonNull(text, "text");
    int tilde = text.indexOf('~');
    if (tilde < 0 || text.indexOf('~', tilde + 1) >= 0) {
      throw new IllegalArgumentException("Formula must contain exactly one '~': " + text);
    }
    String lhs = text.substring(0, tilde).strip();
    String rhs = text.substring(tilde + 1).strip();
    if (rhs.isEmpty()) throw new IllegalArgumentException("Formula has no right-hand side: " + text);

    List<String> outcomes = new ArrayList<>();
    if (!lhs.isEmpty()) {
      for (String token : lhs.split("\\+")) {
        String name = token.strip();
        if (!NAME.matcher(name).matches() || ".".equals(name)) {
          throw new IllegalArgumentException("Invalid outcome '" + name + "' in formula: " + text);
        }
        outcomes.add(name);
      }
    }

    List<Term> terms = new ArrayList<>();
    for (String token : rhs.split("\\+")) {
      Term term = parseTerm(token.strip(), text);
      if (!terms.contains(term)) terms.add(term);
    }
    return new Formula(text.strip(), outcomes, terms);
  }

  private static Term parseTerm(String token, String text) {
    if (".".equals(token)) return Term.DOT;
    if (NAME.matcher(token).matches()) return Term.column(token);
    Matcher call = CALL.matcher(token);
    if (call.matches()) return new Term(call.group(2), TermFunction.byName(call.group(1)));
    throw new IllegalArgumentException("Invalid term '" + token + "' in formula: " + text);
  }

  public String source() { return source; }
  public List<String> outcomes() { return outcomes; }
  public List<Term> terms() { return terms; }

  public boolean hasDot() {
    return terms.contains(Term.DOT);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Formula other)) return false;
    return outcomes.equals(other.outcomes) && terms.equals(other.terms);
  }

  @Override
  public int hashCode() {
    return Objects.hash(outcomes, terms);
  }

  @Override
  public String toString() {
    return source;
  }
}
