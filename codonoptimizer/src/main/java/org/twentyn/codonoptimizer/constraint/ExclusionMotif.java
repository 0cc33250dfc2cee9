/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package org.twentyn.codonoptimizer.constraint;

import org.twentyn.codonoptimizer.sequence.SequenceUtils;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A forbidden DNA motif: a literal site, a site written with degenerate IUPAC bases, or a free-form regular
 * expression.  A codon-aligned motif only counts when a match starts on a codon boundary of the full sequence.
 */
public final class ExclusionMotif {

  /** Span reported for regular expressions, whose match length is not known up front. */
  public static final int VARIABLE_SPAN = -1;

  public enum Kind {
    LITERAL,
    IUPAC,
    REGEX,
  }

  private final String source;
  private final String label;
  private final Kind kind;
  private final Pattern pattern;
  private final int span;
  private final boolean codonAligned;

  private ExclusionMotif(String source, String label, Kind kind, Pattern pattern, int span, boolean codonAligned) {
    this.source = source;
    this.label = label == null ? "" : label;
    this.kind = kind;
    this.pattern = pattern;
    this.span = span;
    this.codonAligned = codonAligned;
  }

  public static ExclusionMotif literal(String site, String label, boolean codonAligned) {
    String seq = site.toUpperCase();
    if (seq.isEmpty() || !SequenceUtils.isDna(seq)) {
      throw new IllegalArgumentException(String.format("Not a literal DNA motif: %s", site));
    }
    return new ExclusionMotif(seq, label, Kind.LITERAL, Pattern.compile(Pattern.quote(seq)), seq.length(),
        codonAligned);
  }

  /**
   * Builds a motif from a recognition site written with IUPAC codes, e.g. CACNNNNGTG.
   */
  public static ExclusionMotif iupac(String site, String label, boolean codonAligned) {
    String seq = site.toUpperCase();
    if (seq.isEmpty() || !SequenceUtils.isIupac(seq)) {
      throw new IllegalArgumentException(String.format("Not an IUPAC motif: %s", site));
    }
    if (SequenceUtils.isDna(seq)) {
      return literal(seq, label, codonAligned);
    }
    return new ExclusionMotif(seq, label, Kind.IUPAC, Pattern.compile(iupacToRegex(seq)), seq.length(), codonAligned);
  }

  /**
   * @throws java.util.regex.PatternSyntaxException If the expression does not compile.
   */
  public static ExclusionMotif regex(String expression, String label, boolean codonAligned) {
    Pattern pattern = Pattern.compile(expression, Pattern.CASE_INSENSITIVE);
    return new ExclusionMotif(expression, label, Kind.REGEX, pattern, VARIABLE_SPAN, codonAligned);
  }

  static String iupacToRegex(String seq) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < seq.length(); i++) {
      char c = seq.charAt(i);
      switch (c) {
        case 'N': sb.append("[ACGT]"); break;
        case 'R': sb.append("[AG]"); break;
        case 'Y': sb.append("[CT]"); break;
        case 'M': sb.append("[AC]"); break;
        case 'K': sb.append("[GT]"); break;
        case 'S': sb.append("[GC]"); break;
        case 'W': sb.append("[AT]"); break;
        case 'B': sb.append("[CGT]"); break;
        case 'V': sb.append("[ACG]"); break;
        case 'D': sb.append("[AGT]"); break;
        case 'H': sb.append("[ACT]"); break;
        default: sb.append(c);
      }
    }
    return sb.toString();
  }

  /**
   * Searches a window of a larger sequence for a match that ends inside the last <code>newBases</code> characters of
   * the window.  Matches lying entirely before that point were already seen when those bases were added.
   * @param window The tail of the sequence being built.
   * @param windowOffset Position of the window's first base in the full sequence, used for codon alignment.
   * @param newBases How many bases at the end of the window were just appended.
   */
  public boolean matchesNewBases(CharSequence window, int windowOffset, int newBases) {
    int boundary = window.length() - newBases;
    Matcher matcher = pattern.matcher(window);
    int from = 0;
    while (from < window.length() && matcher.find(from)) {
      if (matcher.end() > boundary && alignedAt(windowOffset + matcher.start())) {
        return true;
      }
      from = matcher.start() + 1;
    }
    return false;
  }

  /**
   * @return The start of the first match in the sequence, or -1.
   */
  public int firstMatch(CharSequence sequence) {
    Matcher matcher = pattern.matcher(sequence);
    int from = 0;
    while (from < sequence.length() && matcher.find(from)) {
      if (alignedAt(matcher.start())) {
        return matcher.start();
      }
      from = matcher.start() + 1;
    }
    return -1;
  }

  private boolean alignedAt(int position) {
    return !codonAligned || position % 3 == 0;
  }

  public String getSource() {
    return source;
  }

  public String getLabel() {
    return label;
  }

  public Kind getKind() {
    return kind;
  }

  public Pattern getPattern() {
    return pattern;
  }

  public int getSpan() {
    return span;
  }

  public boolean isCodonAligned() {
    return codonAligned;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ExclusionMotif that = (ExclusionMotif) o;
    return codonAligned == that.codonAligned && kind == that.kind && source.equals(that.source);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, kind, codonAligned);
  }

  @Override
  public String toString() {
    String s = label.isEmpty() ? source : source + " (" + label + ")";
    return codonAligned ? s + " @codon" : s;
  }
}
