package ai.pipestream.supervisor.events;

import com.google.protobuf.MessageLite;
import org.apache.kafka.common.serialization.Serializer;

/**
 * Kafka value serializer writing the protobuf wire format.
 */
public class ProtobufSerializer implements Serializer<MessageLite> {

    @Override
    public byte[] serialize(String topic, MessageLite data) {
        return data == null ? null : data.toByteArray();
    }
}
