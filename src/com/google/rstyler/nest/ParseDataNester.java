/*
 * Copyright 2026 The RStyler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.rstyler.nest;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.rstyler.parse.ParseNode;
import com.google.rstyler.parse.ParseNodes;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Builds the nested parse table of one input from the flat table a tokenizer produced.
 *
 * <p>The stages run in this order:
 *
 * <ol>
 *   <li>validation of the tokenizer contract,
 *   <li>mapping of {@code SPECIAL} operators to their sub kinds,
 *   <li>terminal context (kinds of the neighboring terminals),
 *   <li>ignore markers, recorded into a fresh {@link IgnoreRegionState},
 *   <li>nesting,
 *   <li>operator flattening,
 *   <li>relocation of {@code =} assignments, if the input has any.
 * </ol>
 *
 * <p>Every call to {@link #nest} is an independent run with its own error manager and ignore
 * state, so one instance may nest several inputs, also from several threads.
 */
public final class ParseDataNester {

  private static final Logger logger = Logger.getLogger(ParseDataNester.class.getName());

  private final NestOptions options;
  private final Supplier<ErrorManager> errorManagers;

  public ParseDataNester(NestOptions options) {
    this(options, () -> new LoggerErrorManager(logger));
  }

  /**
   * @param errorManagers supplies the error manager of each run; it must return a new instance on
   *     every call
   */
  public ParseDataNester(NestOptions options, Supplier<ErrorManager> errorManagers) {
    options.validate();
    this.options = options;
    this.errorManagers = checkNotNull(errorManagers);
  }

  /**
   * Nests {@code tokens}. The tokens are annotated and linked in place; the returned roots are
   * tokens of the input.
   *
   * @throws InvalidParseTableException if the tokens break the tokenizer contract. No partial
   *     result is produced in that case.
   */
  public NestingResult nest(List<ParseNode> tokens) {
    ErrorManager errorManager = checkNotNull(errorManagers.get());
    IgnoreRegionState ignoreRegions = new IgnoreRegionState();
    List<ParseNode> table = new ArrayList<>(tokens);
    try {
      new ParseTableValidator(errorManager).validate(table);
      ParseNodes.sortByPosId(table);

      new SpecialOperatorMapper().process(table);
      new TerminalContextAnnotator().process(table);
      new StylerIgnoreMarker(options, ignoreRegions, errorManager).process(table);

      for (ParseNode node : table) {
        node.setChildren(null);
      }
      ParseTableNester nester = new ParseTableNester(errorManager);
      List<ParseNode> roots = nester.nest(table);

      if (options.shouldFlattenOperators()) {
        new OperatorFlattener().process(roots);
      }
      if (options.shouldRelocateEqAssign() && EqAssignRelocator.hasEqAssign(table)) {
        new EqAssignRelocator(new NodeIdSupplier(maxId(table))).process(roots);
      }
      return new NestingResult(
          ImmutableList.copyOf(roots),
          ignoreRegions,
          errorManager.getWarnings(),
          nester.getIterationCount());
    } finally {
      errorManager.generateReport();
    }
  }

  private static int maxId(List<ParseNode> table) {
    int max = 0;
    for (ParseNode node : table) {
      max = Math.max(max, node.getId());
    }
    return max;
  }
}
