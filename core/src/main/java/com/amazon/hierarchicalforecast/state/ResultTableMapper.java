/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.hierarchicalforecast.state;

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;
import static com.amazon.hierarchicalforecast.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

import com.amazon.hierarchicalforecast.config.MethodPair;
import com.amazon.hierarchicalforecast.crossvalidation.ResultTable;

/**
 * Maps a {@link ResultTable} to a {@link ResultTableState} and back. Tables
 * rebuilt from a state are frozen.
 */
@Getter
@Setter
public class ResultTableMapper implements IStateMapper<ResultTable, ResultTableState> {

    private FoldResultMapper foldResultMapper = new FoldResultMapper();

    @Override
    public ResultTableState toState(ResultTable model) {
        checkNotNull(model, "table must not be null");
        List<MethodPair> pairs = model.getMethodPairs();
        int foldCount = model.getFoldCount();

        ResultTableState state = new ResultTableState();
        state.setMethodPairs(pairs.stream().map(MethodPair::getCode).toArray(String[]::new));
        state.setFoldCount(foldCount);
        state.setHorizon(model.getHorizon());
        state.setLevels(model.getLevels());
        FoldResultState[] cells = new FoldResultState[pairs.size() * foldCount];
        for (int p = 0; p < pairs.size(); p++) {
            for (int fold = 1; fold <= foldCount; fold++) {
                int slot = p * foldCount + fold - 1;
                model.getFoldResult(pairs.get(p), fold).ifPresent(r -> cells[slot] = foldResultMapper.toState(r));
            }
        }
        state.setCells(cells);
        return state;
    }

    @Override
    public ResultTable toModel(ResultTableState state) {
        checkNotNull(state, "state must not be null");
        checkNotNull(state.getMethodPairs(), "method pairs must be present");
        List<MethodPair> pairs = new ArrayList<>();
        for (String code : state.getMethodPairs()) {
            pairs.add(MethodPair.fromCode(code));
        }
        int foldCount = state.getFoldCount();
        ResultTable table = new ResultTable(pairs, foldCount, state.getHorizon(), state.getLevels());
        FoldResultState[] cells = state.getCells();
        checkArgument(cells != null && cells.length == pairs.size() * foldCount, "incorrect number of cells");
        for (int slot = 0; slot < cells.length; slot++) {
            if (cells[slot] != null) {
                table.record(slot / foldCount, slot % foldCount + 1, foldResultMapper.toModel(cells[slot]));
            }
        }
        table.freeze();
        return table;
    }
}
