package world.willfrog.agentrun.mapper;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Result;
import org.apache.ibatis.annotations.ResultMap;
import org.apache.ibatis.annotations.Results;
import org.apache.ibatis.annotations.Select;
import world.willfrog.agentrun.entity.AgentThreadMessage;

import java.util.List;

@Mapper
public interface AgentThreadMessageMapper {

    @Insert("INSERT INTO agent_thread_message (" +
            "message_id, thread_id, type, role, content, is_llm_message, from_model, metadata, created_at" +
            ") VALUES (" +
            "#{messageId}, #{threadId}, #{type}, #{role}, CAST(#{content} AS jsonb), #{llmMessage}, #{fromModel}, " +
            "CAST(#{metadata} AS jsonb), COALESCE(#{createdAt}, now())" +
            ")")
    int insert(AgentThreadMessage message);

    @Select("SELECT message_id, thread_id, type, role, content, is_llm_message, from_model, metadata, created_at " +
            "FROM agent_thread_message " +
            "WHERE thread_id = #{threadId} AND is_llm_message = true " +
            "ORDER BY created_at ASC, message_id ASC " +
            "LIMIT #{limit} OFFSET #{offset}")
    @Results(id = "threadMessageResultMap", value = {
            @Result(property = "messageId", column = "message_id"),
            @Result(property = "threadId", column = "thread_id"),
            @Result(property = "type", column = "type"),
            @Result(property = "role", column = "role"),
            @Result(property = "content", column = "content"),
            @Result(property = "llmMessage", column = "is_llm_message"),
            @Result(property = "fromModel", column = "from_model"),
            @Result(property = "metadata", column = "metadata"),
            @Result(property = "createdAt", column = "created_at")
    })
    List<AgentThreadMessage> listLlmMessages(@Param("threadId") String threadId,
                                             @Param("limit") int limit,
                                             @Param("offset") int offset);

    @Select("SELECT message_id, thread_id, type, role, content, is_llm_message, from_model, metadata, created_at " +
            "FROM agent_thread_message WHERE message_id = #{messageId}")
    @ResultMap("threadMessageResultMap")
    AgentThreadMessage findById(@Param("messageId") String messageId);

    @Select("SELECT message_id, thread_id, type, role, content, is_llm_message, from_model, metadata, created_at " +
            "FROM agent_thread_message WHERE thread_id = #{threadId} AND type = #{type} " +
            "ORDER BY created_at DESC LIMIT 1")
    @ResultMap("threadMessageResultMap")
    AgentThreadMessage findLatestByType(@Param("threadId") String threadId, @Param("type") String type);
}
