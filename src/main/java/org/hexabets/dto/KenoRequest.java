package org.hexabets.dto;

import java.util.List;

public class KenoRequest extends BetRequest {
    public List<Integer> picks = List.of();
}
