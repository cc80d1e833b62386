package com.project.lingodeck.backend.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse {
    String message;
    Object mainBody;

    public ApiResponse(ResponseMessage responseMessage) {
        this.message = responseMessage.toString();
    }

    public ApiResponse(ResponseMessage responseMessage, Object mainBody) {
        this.message = responseMessage.toString();
        this.mainBody = mainBody;
    }

    //error bodies: the generic message followed by what went wrong
    public static ApiResponse error(ResponseMessage responseMessage, String detail) {
        return new ApiResponse(responseMessage + ": " + detail, null);
    }
}
