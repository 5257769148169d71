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

import org.apache.lucene.queries.spans.SpanQuery;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.ConstantScoreQuery;
import org.apache.lucene.search.DisjunctionMaxQuery;
import org.apache.lucene.search.MultiPhraseQuery;
import org.apache.lucene.search.PhraseQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;

/**
 * The query shapes {@link SpanQueryRewriter} knows how to express as span
 * queries. Anything else is {@link #UNSUPPORTED}.
 */
enum QueryShape {
  BOOLEAN,
  PHRASE,
  TERM,
  SPAN,
  DISJUNCTION_MAX,
  MULTI_PHRASE,
  BOOST,
  CONSTANT_SCORE,
  UNSUPPORTED;

  static QueryShape of(Query query) {
    if (query instanceof BooleanQuery) {
      return BOOLEAN;
    } else if (query instanceof PhraseQuery) {
      return PHRASE;
    } else if (query instanceof TermQuery) {
      return TERM;
    } else if (query instanceof SpanQuery) {
      return SPAN;
    } else if (query instanceof DisjunctionMaxQuery) {
      return DISJUNCTION_MAX;
    } else if (query instanceof MultiPhraseQuery) {
      return MULTI_PHRASE;
    } else if (query instanceof BoostQuery) {
      return BOOST;
    } else if (query instanceof ConstantScoreQuery) {
      return CONSTANT_SCORE;
    }
    return UNSUPPORTED;
  }
}
