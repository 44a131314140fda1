package io.llmcouncil.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.llmcouncil.core.persona.CouncilMode;
import java.io.IOException;
import java.io.Serial;

/// Writes `CouncilMode` as its wire name (`"standard"`, `"specialist"`).
final class CouncilModeCodec {

    private CouncilModeCodec() {}

    static final class Serializer extends StdSerializer<CouncilMode> {

        @Serial private static final long serialVersionUID = 2290463172830716224L;

        Serializer() {
            super(CouncilMode.class);
        }

        @Override
        public void serialize(CouncilMode mode, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            gen.writeString(mode.wireName());
        }
    }

    static final class Deserializer extends StdDeserializer<CouncilMode> {

        @Serial private static final long serialVersionUID = -7783361904185107342L;

        Deserializer() {
            super(CouncilMode.class);
        }

        @Override
        public CouncilMode deserialize(JsonParser p, DeserializationContext ctx)
                throws IOException {
            return CouncilMode.fromWireName(p.getValueAsString());
        }
    }
}
