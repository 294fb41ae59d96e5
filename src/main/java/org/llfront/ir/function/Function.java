package org.llfront.ir.function;

import org.llfront.ir.types.AddressSpace;
import org.llfront.ir.types.ParameterAttribute;
import org.llfront.ir.types.Type;
import org.llfront.ir.values.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A function definition: its signature, linkage properties and body.
 * <p>
 * Blocks are addressed by label. A block written with a label is found under that label;
 * an unlabeled block is found under the slot number the parser assigned to it (e.g. {@code %0}
 * for an unlabeled entry block of a function without unnamed parameters).
 * <p>
 * Instances are immutable and built through {@link #builder()}.
 */
public final class Function {

    private final LinkageType linkage;
    private final PreemptionSpecifier preemptionSpecifier;
    private final Visibility visibility;
    private final Optional<String> callingConvention;
    private final Type returnType;
    private final List<ParameterAttribute> returnAttributes;
    private final String name;
    private final List<FunctionParameter> parameters;
    private final boolean hasVarargs;
    private final UnnamedAddress unnamedAddress;
    private final Optional<AddressSpace> addressSpace;
    private final List<String> functionAttributes;
    private final Optional<String> section;
    private final Optional<String> partition;
    private final OptionalLong alignment;
    private final Optional<String> garbageCollector;
    private final List<BasicBlock> basicBlocks;
    private final Map<String, Integer> blockIndexByLabel;

    private Function(Builder builder) {
        this.linkage = builder.linkage;
        this.preemptionSpecifier = builder.preemptionSpecifier;
        this.visibility = builder.visibility;
        this.callingConvention = Optional.ofNullable(builder.callingConvention);
        this.returnType = Objects.requireNonNull(builder.returnType, "returnType");
        this.returnAttributes = List.copyOf(builder.returnAttributes);
        this.name = Objects.requireNonNull(builder.name, "name");
        if (name.length() < 2 || name.charAt(0) != '@') {
            throw new IllegalArgumentException("Function name must start with '@': " + name);
        }
        this.parameters = List.copyOf(builder.parameters);
        this.hasVarargs = builder.hasVarargs;
        this.unnamedAddress = builder.unnamedAddress;
        this.addressSpace = Optional.ofNullable(builder.addressSpace);
        this.functionAttributes = List.copyOf(builder.functionAttributes);
        this.section = Optional.ofNullable(builder.section);
        this.partition = Optional.ofNullable(builder.partition);
        this.alignment = builder.alignment == null ? OptionalLong.empty() : OptionalLong.of(builder.alignment);
        this.garbageCollector = Optional.ofNullable(builder.garbageCollector);
        if (builder.basicBlocks.isEmpty()) {
            throw new IllegalArgumentException("A function definition needs at least one basic block: " + name);
        }
        this.basicBlocks = List.copyOf(builder.basicBlocks);
        Map<String, Integer> labels = new LinkedHashMap<>();
        for (int i = 0; i < builder.blockLabels.size(); i++) {
            String label = builder.blockLabels.get(i);
            if (label != null && labels.putIfAbsent(label, i) != null) {
                throw new IllegalArgumentException("Duplicate block label '" + label + "' in " + name);
            }
        }
        this.blockIndexByLabel = Collections.unmodifiableMap(labels);
    }

    public static Builder builder() {
        return new Builder();
    }

    public LinkageType linkage() {
        return linkage;
    }

    public PreemptionSpecifier preemptionSpecifier() {
        return preemptionSpecifier;
    }

    public Visibility visibility() {
        return visibility;
    }

    public Optional<String> callingConvention() {
        return callingConvention;
    }

    public Type returnType() {
        return returnType;
    }

    public List<ParameterAttribute> returnAttributes() {
        return returnAttributes;
    }

    /**
     * @return The sigil-qualified name, e.g. {@code @main}.
     */
    public String name() {
        return name;
    }

    public List<FunctionParameter> parameters() {
        return parameters;
    }

    public boolean hasVarargs() {
        return hasVarargs;
    }

    public UnnamedAddress unnamedAddress() {
        return unnamedAddress;
    }

    public Optional<AddressSpace> addressSpace() {
        return addressSpace;
    }

    /**
     * @return Function attribute keywords and attribute group references (e.g. {@code #0}), as written.
     */
    public List<String> functionAttributes() {
        return functionAttributes;
    }

    public Optional<String> section() {
        return section;
    }

    public Optional<String> partition() {
        return partition;
    }

    public OptionalLong alignment() {
        return alignment;
    }

    /**
     * @return The name of the garbage collection strategy, if the function uses one.
     */
    public Optional<String> garbageCollector() {
        return garbageCollector;
    }

    public boolean isGarbageCollected() {
        return garbageCollector.isPresent();
    }

    public List<BasicBlock> basicBlocks() {
        return basicBlocks;
    }

    /**
     * @return The signature of this function.
     */
    public Type.Function type() {
        List<Type> parameterTypes = new ArrayList<>(parameters.size());
        for (FunctionParameter parameter : parameters) {
            parameterTypes.add(parameter.type());
        }
        return new Type.Function(returnType, parameterTypes, hasVarargs);
    }

    /**
     * Returns the label a block is addressed by.
     *
     * @param block A block of this function.
     * @return The explicit or assigned label, without sigil; empty if the block is not part of this function
     *         or was added without one.
     */
    public Optional<String> labelOf(BasicBlock block) {
        for (Map.Entry<String, Integer> entry : blockIndexByLabel.entrySet()) {
            if (basicBlocks.get(entry.getValue()) == block) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up the block a label value names.
     *
     * @param label A label value, e.g. {@code label %exit}.
     * @return The block, or empty if no block of this function carries the label.
     */
    public Optional<BasicBlock> resolveLabel(Value.FromLabel label) {
        Integer index = blockIndexByLabel.get(label.labelName());
        return index == null ? Optional.empty() : Optional.of(basicBlocks.get(index));
    }

    /**
     * Lists the blocks control may continue at after the given block.
     *
     * @param block A block of this function.
     * @return The successor blocks in the terminator's textual order. Destinations that are
     *         not labels of this function are skipped.
     */
    public List<BasicBlock> successorsOf(BasicBlock block) {
        List<BasicBlock> successors = new ArrayList<>();
        for (Value destination : block.terminator().successors()) {
            if (destination instanceof Value.FromLabel label) {
                resolveLabel(label).ifPresent(successors::add);
            }
        }
        return List.copyOf(successors);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Function other)) return false;
        return hasVarargs == other.hasVarargs
                && linkage == other.linkage
                && preemptionSpecifier == other.preemptionSpecifier
                && visibility == other.visibility
                && unnamedAddress == other.unnamedAddress
                && callingConvention.equals(other.callingConvention)
                && returnType.equals(other.returnType)
                && returnAttributes.equals(other.returnAttributes)
                && name.equals(other.name)
                && parameters.equals(other.parameters)
                && addressSpace.equals(other.addressSpace)
                && functionAttributes.equals(other.functionAttributes)
                && section.equals(other.section)
                && partition.equals(other.partition)
                && alignment.equals(other.alignment)
                && garbageCollector.equals(other.garbageCollector)
                && basicBlocks.equals(other.basicBlocks)
                && blockIndexByLabel.equals(other.blockIndexByLabel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, returnType, parameters, basicBlocks);
    }

    @Override
    public String toString() {
        return "Function[name=" + name + ", type=" + type() + ", linkage=" + linkage
                + ", blocks=" + basicBlocks.size() + "]";
    }

    /**
     * Builder for {@link Function}. Linkage, preemption, visibility and unnamed address
     * start at their defaults; every other optional property starts absent.
     */
    public static final class Builder {
        private LinkageType linkage = LinkageType.EXTERNAL;
        private PreemptionSpecifier preemptionSpecifier = PreemptionSpecifier.PREEMPTABLE;
        private Visibility visibility = Visibility.DEFAULT;
        private String callingConvention;
        private Type returnType;
        private final List<ParameterAttribute> returnAttributes = new ArrayList<>();
        private String name;
        private final List<FunctionParameter> parameters = new ArrayList<>();
        private boolean hasVarargs;
        private UnnamedAddress unnamedAddress = UnnamedAddress.NONE;
        private AddressSpace addressSpace;
        private final List<String> functionAttributes = new ArrayList<>();
        private String section;
        private String partition;
        private Long alignment;
        private String garbageCollector;
        private final List<BasicBlock> basicBlocks = new ArrayList<>();
        private final List<String> blockLabels = new ArrayList<>();

        private Builder() {}

        public Builder withLinkage(LinkageType linkage) {
            this.linkage = Objects.requireNonNull(linkage, "linkage");
            return this;
        }

        public Builder withPreemptionSpecifier(PreemptionSpecifier preemptionSpecifier) {
            this.preemptionSpecifier = Objects.requireNonNull(preemptionSpecifier, "preemptionSpecifier");
            return this;
        }

        public Builder withVisibility(Visibility visibility) {
            this.visibility = Objects.requireNonNull(visibility, "visibility");
            return this;
        }

        public Builder withCallingConvention(String callingConvention) {
            this.callingConvention = callingConvention;
            return this;
        }

        public Builder withReturnType(Type returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder withReturnAttributes(List<ParameterAttribute> attributes) {
            this.returnAttributes.addAll(attributes);
            return this;
        }

        /**
         * @param name The sigil-qualified name, e.g. {@code @main}.
         * @return this builder for chaining
         */
        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withParameter(FunctionParameter parameter) {
            this.parameters.add(Objects.requireNonNull(parameter, "parameter"));
            return this;
        }

        public Builder withVarargs(boolean hasVarargs) {
            this.hasVarargs = hasVarargs;
            return this;
        }

        public Builder withUnnamedAddress(UnnamedAddress unnamedAddress) {
            this.unnamedAddress = Objects.requireNonNull(unnamedAddress, "unnamedAddress");
            return this;
        }

        public Builder withAddressSpace(AddressSpace addressSpace) {
            this.addressSpace = addressSpace;
            return this;
        }

        public Builder withFunctionAttribute(String attribute) {
            this.functionAttributes.add(Objects.requireNonNull(attribute, "attribute"));
            return this;
        }

        public Builder withSection(String section) {
            this.section = section;
            return this;
        }

        public Builder withPartition(String partition) {
            this.partition = partition;
            return this;
        }

        public Builder withAlignment(long alignment) {
            this.alignment = alignment;
            return this;
        }

        public Builder withGarbageCollector(String garbageCollector) {
            this.garbageCollector = garbageCollector;
            return this;
        }

        /**
         * Appends a block addressed by its own label. An unlabeled block added this way
         * cannot be found by {@link Function#resolveLabel(Value.FromLabel)}.
         *
         * @param block The block.
         * @return this builder for chaining
         */
        public Builder withBasicBlock(BasicBlock block) {
            return withBasicBlock(block, block.name().orElse(null));
        }

        /**
         * Appends a block addressed by the given label.
         *
         * @param block The block.
         * @param label The label without sigil, e.g. {@code entry} or {@code 0}.
         * @return this builder for chaining
         */
        public Builder withBasicBlock(BasicBlock block, String label) {
            this.basicBlocks.add(Objects.requireNonNull(block, "block"));
            this.blockLabels.add(label);
            return this;
        }

        public Function build() {
            return new Function(this);
        }
    }
}
