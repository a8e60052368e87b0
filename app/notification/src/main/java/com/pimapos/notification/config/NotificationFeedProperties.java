/*
 * Where: Notification application configuration binding
 * What: Table names of the purchase and sale feeds
 * Why: The feeds belong to the dashboard schema and may be renamed or schema-qualified
 */
package com.pimapos.notification.config;

import com.pimapos.notification.model.SourceFeed;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.feeds")
@Validated
public record NotificationFeedProperties(@NotBlank String purchaseTable, @NotBlank String saleTable) {

  public String tableFor(SourceFeed feed) {
    return switch (feed) {
      case PURCHASE -> purchaseTable;
      case SALE -> saleTable;
    };
  }
}
