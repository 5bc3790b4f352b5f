/**
 * SessionRecordStore.java
 *
 * 会话记录的持久化存储。
 */
package club.ppmc.sessionhub.store;

import club.ppmc.sessionhub.model.SessionRecord;
import club.ppmc.sessionhub.model.SessionStatus;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

public interface SessionRecordStore {

    Optional<SessionRecord> findById(String id);

    List<SessionRecord> findByStatus(SessionStatus status);

    /** 按创建时间倒序返回最近的记录。 */
    List<SessionRecord> findRecent(int limit);

    SessionRecord create(SessionRecord record);

    /**
     * 原子地读取-修改-写回一条记录。
     *
     * @return 修改后的记录副本；记录不存在时为空。
     */
    Optional<SessionRecord> update(String id, Consumer<SessionRecord> mutator);
}
