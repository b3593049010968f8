package org.trump304.dto.game;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreateGameReq {
    private Integer mode;           // 2, 3 or 4; defaults to 4

    @Size(max = 20)
    private String playerName;
}
