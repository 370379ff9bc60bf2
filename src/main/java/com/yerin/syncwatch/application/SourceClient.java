package com.yerin.syncwatch.application;

import com.yerin.syncwatch.domain.SourceRecord;
import com.yerin.syncwatch.domain.SyncSource;

import java.util.List;

/**
 * 외부 소스 하나를 읽어 구조화된 레코드로 돌려준다.
 * 같은 데이터를 여러 번 가져와도 안전해야 한다(변경 감지기가 중복을 걸러낸다).
 */
public interface SourceClient {
    SyncSource source();

    List<SourceRecord> fetch(ProgressListener progress) throws Exception;
}
