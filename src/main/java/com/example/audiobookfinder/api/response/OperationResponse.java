package com.example.audiobookfinder.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationResponse {

    private boolean ok;

    private String message;

    public static OperationResponse ok() {
        return new OperationResponse(true, null);
    }
}
