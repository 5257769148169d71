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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.lucene.index.IndexReaderContext;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.PostingsEnum;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.TermStates;
import org.apache.lucene.queries.spans.SpanCollector;
import org.apache.lucene.queries.spans.SpanNearQuery;
import org.apache.lucene.queries.spans.SpanOrQuery;
import org.apache.lucene.queries.spans.SpanQuery;
import org.apache.lucene.queries.spans.SpanTermQuery;
import org.apache.lucene.queries.spans.SpanWeight;
import org.apache.lucene.queries.spans.Spans;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.DocIdSetIterator;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.QueryVisitor;
import org.apache.lucene.search.ScoreMode;
import org.apache.lucene.util.Bits;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.InfoStream;

/**
 * Collects the payloads of the token occurrences a query matches.
 * <p>
 * Operates like a highlighter: the reader should only contain the documents
 * of interest, a <code>MemoryIndex</code> or a small filtered reader being
 * typical. The query is first expressed as span queries by
 * {@link SpanQueryRewriter}, then every span tree is run over all leaves of
 * the context and the payloads at each match are copied out. Payloads are
 * neither deduplicated nor associated with their document.
 * <p>
 * The query must already be rewritten for wildcard and fuzzy support.
 *
 * @lucene.experimental
 */
public class PayloadSpanExtractor {

  private static final String COMPONENT = "PSE";

  private final IndexReaderContext context;
  private final IndexSearcher searcher;
  private final SpanQueryRewriter rewriter = new SpanQueryRewriter();
  private InfoStream infoStream = InfoStream.getDefault();

  /**
   * @param context top level context of the reader that contains the documents
   *                with payloads to extract
   * @see org.apache.lucene.index.IndexReader#getContext()
   */
  public PayloadSpanExtractor(IndexReaderContext context) {
    if (context == null || context.isTopLevel == false) {
      throw new IllegalArgumentException("context must be a top level reader context");
    }
    this.context = context;
    this.searcher = new IndexSearcher(context);
    this.searcher.setQueryCache(null);
  }

  /** Sets the {@link InfoStream} extraction progress is reported to. */
  public void setInfoStream(InfoStream infoStream) {
    this.infoStream = Objects.requireNonNull(infoStream, "infoStream");
  }

  /**
   * Returns the payloads of every token occurrence <code>query</code> matches.
   *
   * @param query rewritten query
   * @return payloads Collection
   * @throws IOException if there is a low-level I/O error
   */
  public Collection<byte[]> getPayloadsForQuery(Query query) throws IOException {
    List<Query> spanQueries = rewriter.rewrite(query);
    if (infoStream.isEnabled(COMPONENT)) {
      infoStream.message(COMPONENT, query + " rewritten to " + spanQueries.size() + " span queries");
    }
    Collection<byte[]> payloads = new ArrayList<>();
    for (Query spanQuery : spanQueries) {
      float boost = 1f;
      while (spanQuery instanceof BoostQuery) {
        boost *= ((BoostQuery) spanQuery).getBoost();
        spanQuery = ((BoostQuery) spanQuery).getQuery();
      }
      extractPayloads((SpanQuery) spanQuery, boost, payloads);
    }
    return payloads;
  }

  /**
   * Runs <code>query</code> over every leaf of the context, in leaf order, and
   * adds the payloads found at each match of a live document to
   * <code>payloads</code>.
   *
   * @throws IOException if there is a low-level I/O error
   */
  public void extractPayloads(SpanQuery query, float boost, Collection<byte[]> payloads) throws IOException {
    Map<Term, TermStates> termStates = buildTermStates(query);
    Query rewritten = searcher.rewrite(withTermStates(query, termStates));
    if (rewritten instanceof SpanQuery == false) {
      // e.g. a span multi-term query without any matching term
      return;
    }
    SpanWeight weight = ((SpanQuery) rewritten).createWeight(searcher, ScoreMode.COMPLETE_NO_SCORES, boost);
    PayloadCollector collector = new PayloadCollector();

    for (LeafReaderContext leaf : context.leaves()) {
      Spans spans = weight.getSpans(leaf, SpanWeight.Postings.PAYLOADS);
      if (spans == null) {
        continue;
      }
      final int start = payloads.size();
      final Bits liveDocs = leaf.reader().getLiveDocs();
      while (spans.nextDoc() != DocIdSetIterator.NO_MORE_DOCS) {
        if (liveDocs != null && liveDocs.get(spans.docID()) == false) {
          continue;
        }
        while (spans.nextStartPosition() != Spans.NO_MORE_POSITIONS) {
          collector.reset();
          spans.collect(collector);
          payloads.addAll(collector.payloads);
        }
      }
      if (infoStream.isEnabled(COMPONENT)) {
        infoStream.message(COMPONENT, "leaf ord=" + leaf.ord + ": " + (payloads.size() - start)
            + " payloads for " + query);
      }
    }
  }

  /** Looks up every term of <code>query</code> once, for all leaves. */
  private Map<Term, TermStates> buildTermStates(SpanQuery query) throws IOException {
    Set<Term> terms = new HashSet<>();
    query.visit(QueryVisitor.termCollector(terms));
    Map<Term, TermStates> termStates = new HashMap<>();
    for (Term term : terms) {
      termStates.put(term, TermStates.build(searcher.getTopReaderContext(), term, false));
    }
    return termStates;
  }

  /**
   * Copies the term, near and or nodes of <code>query</code> so that each term
   * uses its prebuilt {@link TermStates}. Other span queries are kept as they
   * are and look their terms up themselves.
   */
  private static SpanQuery withTermStates(SpanQuery query, Map<Term, TermStates> termStates) {
    if (query.getClass() == SpanTermQuery.class) {
      Term term = ((SpanTermQuery) query).getTerm();
      return new SpanTermQuery(term, termStates.get(term));
    } else if (query.getClass() == SpanNearQuery.class) {
      SpanNearQuery near = (SpanNearQuery) query;
      return new SpanNearQuery(withTermStates(near.getClauses(), termStates), near.getSlop(), near.isInOrder());
    } else if (query.getClass() == SpanOrQuery.class) {
      return new SpanOrQuery(withTermStates(((SpanOrQuery) query).getClauses(), termStates));
    }
    return query;
  }

  private static SpanQuery[] withTermStates(SpanQuery[] clauses, Map<Term, TermStates> termStates) {
    SpanQuery[] bound = new SpanQuery[clauses.length];
    for (int i = 0; i < clauses.length; i++) {
      bound[i] = withTermStates(clauses[i], termStates);
    }
    return bound;
  }

  /** Copies the payload, if any, of every leaf term position of the current match. */
  private static final class PayloadCollector implements SpanCollector {

    final List<byte[]> payloads = new ArrayList<>();

    @Override
    public void collectLeaf(PostingsEnum postings, int position, Term term) throws IOException {
      BytesRef payload = postings.getPayload();
      if (payload == null) {
        return;
      }
      payloads.add(BytesRef.deepCopyOf(payload).bytes);
    }

    @Override
    public void reset() {
      payloads.clear();
    }
  }
}
