/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.searchaugment.payloads;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.lucene.index.Term;
import org.apache.lucene.queries.spans.SpanNearQuery;
import org.apache.lucene.queries.spans.SpanOrQuery;
import org.apache.lucene.queries.spans.SpanQuery;
import org.apache.lucene.queries.spans.SpanTermQuery;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.ConstantScoreQuery;
import org.apache.lucene.search.DisjunctionMaxQuery;
import org.apache.lucene.search.MultiPhraseQuery;
import org.apache.lucene.search.PhraseQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;

/**
 * Rewrites the positional content of a query into span queries.
 * <p>
 * The result is a list of independent span trees: each element is a
 * {@link SpanQuery}, or a {@link BoostQuery} wrapping one when the source
 * query carried a boost. Clauses of a boolean or disjunction query are
 * rewritten independently since they may target different fields.
 * <ul>
 * <li>{@link BooleanQuery}: every clause but <code>MUST_NOT</code> is
 * rewritten. A <code>FILTER</code> clause is rewritten like any other clause
 * and does not restrict the others, so matches may be reported for documents
 * the filter would exclude.</li>
 * <li>{@link PhraseQuery}: a {@link SpanNearQuery} over the terms in phrase
 * order, in order only if the slop is 0. A single term phrase is just its
 * {@link SpanTermQuery}.</li>
 * <li>{@link MultiPhraseQuery}: a {@link SpanNearQuery} over one
 * {@link SpanOrQuery} per occupied position, see
 * {@link #rewriteMultiPhrase(MultiPhraseQuery)}.</li>
 * <li>{@link TermQuery}: a {@link SpanTermQuery}.</li>
 * <li>{@link SpanQuery}: returned as is.</li>
 * <li>{@link DisjunctionMaxQuery}: every disjunct, unweighted.</li>
 * <li>{@link BoostQuery}, {@link ConstantScoreQuery}: the wrapped query.</li>
 * </ul>
 * Other queries contribute nothing; wildcard, prefix and fuzzy queries must be
 * rewritten into term based queries first.
 * <p>
 * This class holds no state and does not access any index.
 *
 * @lucene.experimental
 */
public class SpanQueryRewriter {

  /** Returns the span trees equivalent to the positional parts of <code>query</code>. */
  public List<Query> rewrite(Query query) {
    switch (QueryShape.of(query)) {
      case BOOLEAN:
        return rewriteBoolean((BooleanQuery) query);
      case PHRASE:
        return rewritePhrase((PhraseQuery) query);
      case TERM:
        return Collections.singletonList(new SpanTermQuery(((TermQuery) query).getTerm()));
      case SPAN:
        return Collections.singletonList(query);
      case DISJUNCTION_MAX:
        return rewriteAll(((DisjunctionMaxQuery) query).getDisjuncts());
      case MULTI_PHRASE:
        return rewriteMultiPhrase((MultiPhraseQuery) query);
      case BOOST:
        return rewriteBoost((BoostQuery) query);
      case CONSTANT_SCORE:
        return rewrite(((ConstantScoreQuery) query).getQuery());
      case UNSUPPORTED:
        return Collections.emptyList();
      default:
        throw new AssertionError("unhandled query shape: " + QueryShape.of(query));
    }
  }

  private List<Query> rewriteBoolean(BooleanQuery query) {
    List<Query> spanQueries = new ArrayList<>();
    for (BooleanClause clause : query) {
      switch (clause.getOccur()) {
        case MUST:
        case SHOULD:
        case FILTER:
          spanQueries.addAll(rewrite(clause.getQuery()));
          break;
        case MUST_NOT:
          break;
        default:
          throw new AssertionError("unhandled occur: " + clause.getOccur());
      }
    }
    return spanQueries;
  }

  private List<Query> rewriteAll(Iterable<Query> queries) {
    List<Query> spanQueries = new ArrayList<>();
    for (Query query : queries) {
      spanQueries.addAll(rewrite(query));
    }
    return spanQueries;
  }

  private List<Query> rewritePhrase(PhraseQuery query) {
    Term[] terms = query.getTerms();
    if (terms.length == 0) {
      return Collections.emptyList();
    }
    SpanQuery[] clauses = new SpanQuery[terms.length];
    for (int i = 0; i < terms.length; i++) {
      clauses[i] = new SpanTermQuery(terms[i]);
    }
    int slop = query.getSlop();
    return Collections.singletonList(near(clauses, slop, slop == 0));
  }

  /**
   * Builds one clause per distinct position, in position order: the term
   * itself when a position holds a single term, otherwise a
   * {@link SpanOrQuery} over its terms. Unused positions in between are not
   * materialized; instead the slop grows by one per unused position. Whether
   * the clauses must match in order is still decided by the query's own slop.
   * With a single distinct position its clause is returned as is.
   */
  List<Query> rewriteMultiPhrase(MultiPhraseQuery query) {
    Term[][] termArrays = query.getTermArrays();
    int[] positions = query.getPositions();
    if (positions.length == 0) {
      return Collections.emptyList();
    }

    int maxPosition = positions[positions.length - 1];
    for (int i = 0; i < positions.length - 1; ++i) {
      if (positions[i] > maxPosition) {
        maxPosition = positions[i];
      }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    final List<SpanQuery>[] disjunctLists = new List[maxPosition + 1];
    int distinctPositions = 0;
    for (int i = 0; i < termArrays.length; ++i) {
      List<SpanQuery> disjuncts = disjunctLists[positions[i]];
      if (disjuncts == null) {
        disjuncts = disjunctLists[positions[i]] = new ArrayList<>(termArrays[i].length);
        ++distinctPositions;
      }
      for (Term term : termArrays[i]) {
        disjuncts.add(new SpanTermQuery(term));
      }
    }

    int positionGaps = 0;
    int position = 0;
    final SpanQuery[] clauses = new SpanQuery[distinctPositions];
    for (List<SpanQuery> disjuncts : disjunctLists) {
      if (disjuncts == null) {
        ++positionGaps;
      } else if (disjuncts.size() == 1) {
        clauses[position++] = disjuncts.get(0);
      } else {
        clauses[position++] = new SpanOrQuery(disjuncts.toArray(new SpanQuery[0]));
      }
    }

    final int slop = query.getSlop();
    final boolean inOrder = (slop == 0);
    return Collections.singletonList(near(clauses, slop + positionGaps, inOrder));
  }

  /** A near query over <code>clauses</code>, or the clause itself if there is only one. */
  private static SpanQuery near(SpanQuery[] clauses, int slop, boolean inOrder) {
    if (clauses.length == 1) {
      // span conjunctions need at least two sub spans
      return clauses[0];
    }
    return new SpanNearQuery(clauses, slop, inOrder);
  }

  private List<Query> rewriteBoost(BoostQuery query) {
    List<Query> rewritten = rewrite(query.getQuery());
    List<Query> boosted = new ArrayList<>(rewritten.size());
    for (Query spanQuery : rewritten) {
      float boost = query.getBoost();
      if (spanQuery instanceof BoostQuery) {
        boost *= ((BoostQuery) spanQuery).getBoost();
        spanQuery = ((BoostQuery) spanQuery).getQuery();
      }
      boosted.add(new BoostQuery(spanQuery, boost));
    }
    return boosted;
  }
}
