package com.pitlane.timing.infrastructure.web.dto;

import java.util.List;

public record SeasonsResponse(List<Integer> seasons) {}
