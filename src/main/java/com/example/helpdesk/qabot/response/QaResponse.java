package com.example.helpdesk.qabot.response;

import com.example.helpdesk.qabot.model.RankedFaq;
import com.example.helpdesk.qabot.model.RankedProduct;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QaResponse {
  private List<RankedProduct> products;
  private List<RankedFaq> faqs;
  private String answer;

  private String error;
  private Boolean loading;
  private String message;

  public static QaResponse error(String error) {
    return QaResponse.builder().error(error).build();
  }

  public static QaResponse loading(String message) {
    return QaResponse.builder().loading(true).message(message).build();
  }
}
