/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.pipeline.run;

import org.apache.calcite.adapter.pipeline.PipelineException;
import org.apache.calcite.adapter.pipeline.batch.RecordBatch;
import org.apache.calcite.adapter.pipeline.materialize.PartitionKeyFunction;
import org.apache.calcite.adapter.pipeline.materialize.PartitionedMaterializer;
import org.apache.calcite.adapter.pipeline.materialize.WriteSummary;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Writes the validated relation to the partitioned sink. Always re-run;
 * partitions whose content is unchanged are not rewritten.
 */
public class MaterializeNode implements PipelineNode {
  public static final String NAME = "materialize";

  private final PartitionedMaterializer materializer;
  private final PartitionKeyFunction keyFunction;
  private final String sink;
  private final String compression;

  public MaterializeNode(PartitionedMaterializer materializer, PartitionKeyFunction keyFunction,
      String sink, String compression) {
    this.materializer = materializer;
    this.keyFunction = keyFunction;
    this.sink = sink;
    this.compression = compression;
  }

  @Override public String getName() {
    return NAME;
  }

  @Override public List<String> getPredecessors() {
    return ImmutableList.of(ValidateNode.NAME);
  }

  @Override public String inputFingerprint(RunContext context) {
    return Fingerprints.of(context.outputFingerprint(ValidateNode.NAME),
        keyFunction.getColumns(), sink, compression);
  }

  @Override public String run(RunContext context) throws PipelineException {
    RecordBatch batch = context.get(ValidateNode.BATCH, RecordBatch.class);
    WriteSummary summary = materializer.write(batch, keyFunction, sink);
    context.setWriteSummary(summary);
    return Fingerprints.of(context.outputFingerprint(ValidateNode.NAME), sink,
        summary.getTotalRows());
  }
}
