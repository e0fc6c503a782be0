package me.golemcore.archivist.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompressionActionDto {
    private String type;
    private List<String> producedIds;
    private List<Integer> producedLevels;
    private List<String> evictedIds;
    private int budgetAfter;
}
