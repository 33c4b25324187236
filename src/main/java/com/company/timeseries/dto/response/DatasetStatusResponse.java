package com.company.timeseries.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DatasetStatusResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private String name;
    private boolean active;
    private boolean backfilled;
}
