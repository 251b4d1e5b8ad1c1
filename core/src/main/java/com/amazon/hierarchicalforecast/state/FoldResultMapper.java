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

import com.amazon.hierarchicalforecast.crossvalidation.CellStatus;
import com.amazon.hierarchicalforecast.crossvalidation.FoldResult;

public class FoldResultMapper implements IStateMapper<FoldResult, FoldResultState> {

    @Override
    public FoldResultState toState(FoldResult model) {
        FoldResultState state = new FoldResultState();
        state.setStatus(model.getStatus().name());
        state.setFailureReason(model.getFailureReason().orElse(null));
        state.setLevels(model.getLevels());
        state.setValues(model.getValues());
        state.setLevelValues(model.getLevelValues());
        return state;
    }

    @Override
    public FoldResult toModel(FoldResultState state) {
        checkArgument(state.getStatus() != null, "status must be present");
        CellStatus status = CellStatus.valueOf(state.getStatus());
        switch (status) {
        case COMPLETED:
            return FoldResult.completed(state.getLevels(), state.getValues(), state.getLevelValues());
        case FAILED:
            return FoldResult.failed(state.getFailureReason());
        default:
            return FoldResult.timedOut(state.getFailureReason());
        }
    }
}
