package world.willfrog.agentrun.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Result;
import org.apache.ibatis.annotations.Results;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;
import world.willfrog.agentrun.entity.AgentRun;
import world.willfrog.agentrun.model.AgentRunStatus;

@Mapper
public interface AgentRunMapper {

    @Select("SELECT id, thread_id, project_id, status, error, responses, started_at, completed_at, updated_at " +
            "FROM agent_run WHERE id = #{id}")
    @Results(id = "agentRunResultMap", value = {
            @Result(property = "id", column = "id"),
            @Result(property = "threadId", column = "thread_id"),
            @Result(property = "projectId", column = "project_id"),
            @Result(property = "status", column = "status"),
            @Result(property = "error", column = "error"),
            @Result(property = "responses", column = "responses"),
            @Result(property = "startedAt", column = "started_at"),
            @Result(property = "completedAt", column = "completed_at"),
            @Result(property = "updatedAt", column = "updated_at")
    })
    AgentRun findById(@Param("id") String id);

    /**
     * 进入 RUNNING。只有 CREATED/RUNNING 的 run 会被更新，重复投递到已终态的 run 返回 0。
     */
    @Update("UPDATE agent_run SET status = 'RUNNING', " +
            "started_at = COALESCE(started_at, now()), updated_at = now() " +
            "WHERE id = #{id} AND status IN ('CREATED', 'RUNNING')")
    int markRunning(@Param("id") String id);

    /**
     * 写入终态。已是终态的 run 不会被覆盖（返回 0）。
     */
    @Update("<script>" +
            "UPDATE agent_run SET status = #{status}, error = #{error}, " +
            "<if test='responses != null'>responses = CAST(#{responses} AS jsonb), </if>" +
            "completed_at = now(), updated_at = now() " +
            "WHERE id = #{id} AND status NOT IN ('COMPLETED', 'FAILED', 'STOPPED')" +
            "</script>")
    int updateTerminal(@Param("id") String id,
                       @Param("status") AgentRunStatus status,
                       @Param("error") String error,
                       @Param("responses") String responses);
}
