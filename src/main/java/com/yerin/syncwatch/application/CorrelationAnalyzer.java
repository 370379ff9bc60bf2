package com.yerin.syncwatch.application;

import java.util.Map;

public interface CorrelationAnalyzer {
    /** 저장된 데이터만 읽어 파생 값을 다시 계산하고 요약을 돌려준다. */
    Map<String, Object> analyze(ProgressListener progress);
}
