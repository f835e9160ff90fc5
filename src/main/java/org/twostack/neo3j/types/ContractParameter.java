
/*
 * Copyright 2021 Stephan M. February
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.twostack.neo3j.types;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.twostack.neo3j.Hash160;
import org.twostack.neo3j.Hash256;
import org.twostack.neo3j.NeoConstants;
import org.twostack.neo3j.PublicKey;
import org.twostack.neo3j.Utils;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * <p>A typed value passed to a contract method, or pushed as a verification parameter of a contract signer.</p>
 *
 * <p>The set of subclasses is closed. Code that needs to handle every kind of parameter implements
 * {@link Visitor}, so that adding a kind breaks every consumer at compile time.</p>
 *
 * <p>Parameters convert to and from the JSON form used by node RPC calls:
 * {@code {"type":"Integer","value":"42"}}.</p>
 */
public abstract class ContractParameter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Nullable
    private final String name;

    private ContractParameter(@Nullable String name) {
        this.name = name;
    }

    @Nullable
    public String getName() {
        return name;
    }

    public abstract ContractParameterType getType();

    public abstract Object getValue();

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitBoolean(BooleanParameter parameter);

        R visitInteger(IntegerParameter parameter);

        R visitByteArray(ByteArrayParameter parameter);

        R visitString(StringParameter parameter);

        R visitHash160(Hash160Parameter parameter);

        R visitHash256(Hash256Parameter parameter);

        R visitPublicKey(PublicKeyParameter parameter);

        R visitSignature(SignatureParameter parameter);

        R visitArray(ArrayParameter parameter);

        R visitMap(MapParameter parameter);

        R visitAny(AnyParameter parameter);
    }

    // factories

    public static ContractParameter bool(boolean value) {
        return new BooleanParameter(null, value);
    }

    public static ContractParameter integer(int value) {
        return integer(BigInteger.valueOf(value));
    }

    public static ContractParameter integer(long value) {
        return integer(BigInteger.valueOf(value));
    }

    public static ContractParameter integer(BigInteger value) {
        return new IntegerParameter(null, value);
    }

    public static ContractParameter byteArray(byte[] value) {
        return new ByteArrayParameter(null, value);
    }

    public static ContractParameter byteArrayFromString(String value) {
        return byteArray(value.getBytes(StandardCharsets.UTF_8));
    }

    public static ContractParameter string(String value) {
        return new StringParameter(null, value);
    }

    public static ContractParameter hash160(Hash160 value) {
        return new Hash160Parameter(null, value);
    }

    public static ContractParameter hash256(Hash256 value) {
        return new Hash256Parameter(null, value);
    }

    public static ContractParameter publicKey(PublicKey value) {
        return new PublicKeyParameter(null, value.getEncoded());
    }

    public static ContractParameter publicKey(byte[] encoded) {
        return new PublicKeyParameter(null, encoded);
    }

    public static ContractParameter signature(byte[] value) {
        return new SignatureParameter(null, value);
    }

    public static ContractParameter signature(String hex) {
        return signature(Utils.HEX.decode(hex.toLowerCase()));
    }

    public static ContractParameter array(List<ContractParameter> values) {
        return new ArrayParameter(null, values);
    }

    public static ContractParameter array(ContractParameter... values) {
        return array(Arrays.asList(values));
    }

    public static ContractParameter map(Map<ContractParameter, ContractParameter> values) {
        return new MapParameter(null, values);
    }

    public static ContractParameter any() {
        return new AnyParameter(null);
    }

    // JSON

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toJsonNode());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to write contract parameter as JSON", ex);
        }
    }

    public ObjectNode toJsonNode() {
        ObjectNode node = MAPPER.createObjectNode();
        if (name != null) {
            node.put("name", name);
        }
        node.put("type", getType().jsonValue());
        accept(new JsonValueWriter(node));
        return node;
    }

    public static ContractParameter fromJson(String json) {
        try {
            return fromJsonNode(MAPPER.readTree(json));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid contract parameter JSON", ex);
        }
    }

    public static ContractParameter fromJsonNode(JsonNode node) {
        checkArgument(node != null && node.isObject(), "Contract parameter JSON must be an object");
        JsonNode typeNode = node.get("type");
        checkArgument(typeNode != null, "Contract parameter JSON lacks a type");
        String name = node.hasNonNull("name") ? node.get("name").asText() : null;
        ContractParameterType type = ContractParameterType.fromJsonValue(typeNode.asText());
        JsonNode value = node.get("value");

        if (type == ContractParameterType.ANY) {
            return new AnyParameter(name);
        }
        checkArgument(value != null && !value.isNull(), "Contract parameter of type %s lacks a value", type.jsonValue());

        switch (type) {
            case BOOLEAN:
                return new BooleanParameter(name, value.asBoolean());
            case INTEGER:
                return new IntegerParameter(name, new BigInteger(value.asText()));
            case BYTE_ARRAY:
                return new ByteArrayParameter(name, Utils.BASE64.decode(value.asText()));
            case STRING:
                return new StringParameter(name, value.asText());
            case HASH160:
                return new Hash160Parameter(name, new Hash160(value.asText()));
            case HASH256:
                return new Hash256Parameter(name, new Hash256(value.asText()));
            case PUBLIC_KEY:
                return new PublicKeyParameter(name, Utils.HEX.decode(value.asText().toLowerCase()));
            case SIGNATURE:
                return new SignatureParameter(name, Utils.BASE64.decode(value.asText()));
            case ARRAY: {
                checkArgument(value.isArray(), "Array parameter value must be a JSON array");
                List<ContractParameter> items = new ArrayList<>();
                for (JsonNode item : value) {
                    items.add(fromJsonNode(item));
                }
                return new ArrayParameter(name, items);
            }
            case MAP: {
                checkArgument(value.isArray(), "Map parameter value must be a JSON array of entries");
                Map<ContractParameter, ContractParameter> entries = new LinkedHashMap<>();
                for (JsonNode entry : value) {
                    entries.put(fromJsonNode(entry.get("key")), fromJsonNode(entry.get("value")));
                }
                return new MapParameter(name, entries);
            }
            default:
                throw new IllegalArgumentException("Unsupported contract parameter type: " + type.jsonValue());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContractParameter that = (ContractParameter) o;
        return Objects.equals(name, that.name) && valueEquals(that);
    }

    protected boolean valueEquals(ContractParameter other) {
        return Objects.equals(getValue(), other.getValue());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, getType(), valueHashCode());
    }

    protected int valueHashCode() {
        return Objects.hashCode(getValue());
    }

    @Override
    public String toString() {
        return toJson();
    }

    // variants

    public static final class BooleanParameter extends ContractParameter {
        private final boolean value;

        BooleanParameter(@Nullable String name, boolean value) {
            super(name);
            this.value = value;
        }

        @Override
        public ContractParameterType getType() {
            return ContractParameterType.BOOLEAN;
        }

        @Override
        public Boolean getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    public static final class IntegerParameter extends ContractParameter {
        private final BigInteger value;

        IntegerParameter(@Nullable String name, BigInteger value) {
            super(name);
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public ContractParameterType getType() {
            return ContractParameterType.INTEGER;
        }

        @Override
        public BigInteger getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInteger(this);
        }
    }

    /** Base for the variants that hold raw bytes. */
    public abstract static class BytesParameter extends ContractParameter {
        private final byte[] value;

        BytesParameter(@Nullable String name, byte[] value) {
            super(name);
            this.value = Objects.requireNonNull(value).clone();
        }

        @Override
        public byte[] getValue() {
            return value.clone();
        }

        @Override
        protected boolean valueEquals(ContractParameter other) {
            return Arrays.equals(value, ((BytesParameter) other).value);
        }

        @Override
        protected int valueHashCode() {
            return Arrays.hashCode(value);
        }
    }

    public static final class ByteArrayParameter extends BytesParameter {
        ByteArrayParameter(@Nullable String name, byte[] value) {
            super(name, value);
        }

        @Override
        public ContractParameterType getType() {
            return ContractParameterType.BYTE_ARRAY;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitByteArray(this);
        }
    }

    public static final class PublicKeyParameter extends BytesParameter {
        PublicKeyParameter(@Nullable String name, byte[] value) {
            super(name, value);
            checkArgument(value.length == NeoConstants.PUBLIC_KEY_SIZE_COMPRESSED,
                    "Public key parameter must be %s bytes but was %s", NeoConstants.PUBLIC_KEY_SIZE_COMPRESSED,
                    value.length);
        }

        @Override
        public ContractParameterType getType() {
            return ContractParameterType.PUBLIC_KEY;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPublicKey(this);
        }
    }

    public static final class SignatureParameter extends BytesParameter {
        SignatureParameter(@Nullable String name, byte[] value) {
            super(name, value);
            checkArgument(value.length == NeoConstants.SIGNATURE_SIZE,
                    "Signature parameter must be %s bytes but was %s", NeoConstants.SIGNATURE_SIZE, value.length);
        }

        @Override
        public ContractParameterType getType() {
            return ContractParameterType.SIGNATURE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSignature(this);
        }
    }

    public static final class StringParameter extends ContractParameter {
        private final String value;

        StringParameter(@Nullable String name, String value) {
            super(name);
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public ContractParameterType getType() {
            return ContractParameterType.STRING;
        }

        @Override
        public String getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    public static final class Hash160Parameter extends ContractParameter {
        private final Hash160 value;

        Hash160Parameter(@Nullable String name, Hash160 value) {
            super(name);
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public ContractParameterType getType() {
            return ContractParameterType.HASH160;
        }

        @Override
        public Hash160 getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitHash160(this);
        }
    }

    public static final class Hash256Parameter extends ContractParameter {
        private final Hash256 value;

        Hash256Parameter(@Nullable String name, Hash256 value) {
            super(name);
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public ContractParameterType getType() {
            return ContractParameterType.HASH256;
        }

        @Override
        public Hash256 getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitHash256(this);
        }
    }

    public static final class ArrayParameter extends ContractParameter {
        private final List<ContractParameter> value;

        ArrayParameter(@Nullable String name, List<ContractParameter> value) {
            super(name);
            this.value = Collections.unmodifiableList(new ArrayList<>(value));
        }

        @Override
        public ContractParameterType getType() {
            return ContractParameterType.ARRAY;
        }

        @Override
        public List<ContractParameter> getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    /** Map parameter. Entry order is kept, since it determines the pushed bytecode. */
    public static final class MapParameter extends ContractParameter {
        private final Map<ContractParameter, ContractParameter> value;

        MapParameter(@Nullable String name, Map<ContractParameter, ContractParameter> value) {
            super(name);
            for (ContractParameter key : value.keySet()) {
                ContractParameterType keyType = key.getType();
                checkArgument(keyType != ContractParameterType.ARRAY && keyType != ContractParameterType.MAP
                        && keyType != ContractParameterType.ANY, "Map keys must be primitive, not %s",
                        keyType.jsonValue());
            }
            this.value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
        }

        @Override
        public ContractParameterType getType() {
            return ContractParameterType.MAP;
        }

        @Override
        public Map<ContractParameter, ContractParameter> getValue() {
            return value;
        }

        @Override
        protected boolean valueEquals(ContractParameter other) {
            Map<ContractParameter, ContractParameter> otherValue = ((MapParameter) other).value;
            if (value.size() != otherValue.size()) return false;
            Iterator<Map.Entry<ContractParameter, ContractParameter>> a = value.entrySet().iterator();
            Iterator<Map.Entry<ContractParameter, ContractParameter>> b = otherValue.entrySet().iterator();
            while (a.hasNext()) {
                if (!a.next().equals(b.next())) return false;
            }
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMap(this);
        }
    }

    public static final class AnyParameter extends ContractParameter {
        AnyParameter(@Nullable String name) {
            super(name);
        }

        @Override
        public ContractParameterType getType() {
            return ContractParameterType.ANY;
        }

        @Override
        @Nullable
        public Object getValue() {
            return null;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAny(this);
        }
    }

    private static class JsonValueWriter implements Visitor<Void> {
        private final ObjectNode node;

        JsonValueWriter(ObjectNode node) {
            this.node = node;
        }

        @Override
        public Void visitBoolean(BooleanParameter parameter) {
            node.put("value", parameter.getValue());
            return null;
        }

        @Override
        public Void visitInteger(IntegerParameter parameter) {
            node.put("value", parameter.getValue().toString());
            return null;
        }

        @Override
        public Void visitByteArray(ByteArrayParameter parameter) {
            node.put("value", Utils.BASE64.encode(parameter.getValue()));
            return null;
        }

        @Override
        public Void visitString(StringParameter parameter) {
            node.put("value", parameter.getValue());
            return null;
        }

        @Override
        public Void visitHash160(Hash160Parameter parameter) {
            node.put("value", parameter.getValue().toString());
            return null;
        }

        @Override
        public Void visitHash256(Hash256Parameter parameter) {
            node.put("value", parameter.getValue().toString());
            return null;
        }

        @Override
        public Void visitPublicKey(PublicKeyParameter parameter) {
            node.put("value", Utils.HEX.encode(parameter.getValue()));
            return null;
        }

        @Override
        public Void visitSignature(SignatureParameter parameter) {
            node.put("value", Utils.BASE64.encode(parameter.getValue()));
            return null;
        }

        @Override
        public Void visitArray(ArrayParameter parameter) {
            ArrayNode array = node.putArray("value");
            for (ContractParameter item : parameter.getValue()) {
                array.add(item.toJsonNode());
            }
            return null;
        }

        @Override
        public Void visitMap(MapParameter parameter) {
            ArrayNode array = node.putArray("value");
            for (Map.Entry<ContractParameter, ContractParameter> entry : parameter.getValue().entrySet()) {
                ObjectNode entryNode = array.addObject();
                entryNode.set("key", entry.getKey().toJsonNode());
                entryNode.set("value", entry.getValue().toJsonNode());
            }
            return null;
        }

        @Override
        public Void visitAny(AnyParameter parameter) {
            node.putNull("value");
            return null;
        }
    }
}
