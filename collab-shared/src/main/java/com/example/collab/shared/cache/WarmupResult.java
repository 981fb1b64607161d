package com.example.collab.shared.cache;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class WarmupResult {
    private int success;
    private int skipped;
    private int failed;
}
