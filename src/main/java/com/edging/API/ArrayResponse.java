package com.edging.API;

import com.edging.imageOperator.Dense2DArray;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArrayResponse {
    private final int rows;
    private final int cols;
    private final int channels;
    private final Integer edgeCount;
    private final double[] data;

    public static ArrayResponse of(Dense2DArray array) {
        return new ArrayResponse(array.getRows(), array.getCols(), array.getChannels(), null, array.getData());
    }

    public static ArrayResponse edges(Dense2DArray array, int edgeCount) {
        return new ArrayResponse(array.getRows(), array.getCols(), array.getChannels(), edgeCount, array.getData());
    }
}
