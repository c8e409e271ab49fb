package com.gridcast.service;

import com.gridcast.model.MergeEvent;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * 合并监听器。onMerged 在合并事务内执行（暂存行仍可见），异常会使整批回滚；
 * afterCommit 在提交之后执行
 */
public interface MergeListener {

    /**
     * 为 true 时，该事件的合并事务与其它同样返回 true 的事务串行执行直到提交，
     * 用于会读取并改写跨实体共享行的监听器
     */
    default boolean requiresSerialCommit(MergeEvent event) {
        return false;
    }

    default void onMerged(Connection connection, MergeEvent event) throws SQLException {
    }

    default void afterCommit(MergeEvent event) {
    }
}
