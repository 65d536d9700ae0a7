package io.github.eutro.jvmjit.classfile.code;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * The JVM instruction set, with the byte value of each opcode and the form its operands take.
 */
public enum Opcode {
    NOP(0, Form.NONE),
    ACONST_NULL(1, Form.NONE),
    ICONST_M1(2, Form.NONE),
    ICONST_0(3, Form.NONE),
    ICONST_1(4, Form.NONE),
    ICONST_2(5, Form.NONE),
    ICONST_3(6, Form.NONE),
    ICONST_4(7, Form.NONE),
    ICONST_5(8, Form.NONE),
    LCONST_0(9, Form.NONE),
    LCONST_1(10, Form.NONE),
    FCONST_0(11, Form.NONE),
    FCONST_1(12, Form.NONE),
    FCONST_2(13, Form.NONE),
    DCONST_0(14, Form.NONE),
    DCONST_1(15, Form.NONE),
    BIPUSH(16, Form.PUSH),
    SIPUSH(17, Form.PUSH),
    LDC(18, Form.CONSTANT),
    LDC_W(19, Form.CONSTANT),
    LDC2_W(20, Form.CONSTANT),
    ILOAD(21, Form.LOCAL),
    LLOAD(22, Form.LOCAL),
    FLOAD(23, Form.LOCAL),
    DLOAD(24, Form.LOCAL),
    ALOAD(25, Form.LOCAL),
    ILOAD_0(26, Form.NONE),
    ILOAD_1(27, Form.NONE),
    ILOAD_2(28, Form.NONE),
    ILOAD_3(29, Form.NONE),
    LLOAD_0(30, Form.NONE),
    LLOAD_1(31, Form.NONE),
    LLOAD_2(32, Form.NONE),
    LLOAD_3(33, Form.NONE),
    FLOAD_0(34, Form.NONE),
    FLOAD_1(35, Form.NONE),
    FLOAD_2(36, Form.NONE),
    FLOAD_3(37, Form.NONE),
    DLOAD_0(38, Form.NONE),
    DLOAD_1(39, Form.NONE),
    DLOAD_2(40, Form.NONE),
    DLOAD_3(41, Form.NONE),
    ALOAD_0(42, Form.NONE),
    ALOAD_1(43, Form.NONE),
    ALOAD_2(44, Form.NONE),
    ALOAD_3(45, Form.NONE),
    IALOAD(46, Form.NONE),
    LALOAD(47, Form.NONE),
    FALOAD(48, Form.NONE),
    DALOAD(49, Form.NONE),
    AALOAD(50, Form.NONE),
    BALOAD(51, Form.NONE),
    CALOAD(52, Form.NONE),
    SALOAD(53, Form.NONE),
    ISTORE(54, Form.LOCAL),
    LSTORE(55, Form.LOCAL),
    FSTORE(56, Form.LOCAL),
    DSTORE(57, Form.LOCAL),
    ASTORE(58, Form.LOCAL),
    ISTORE_0(59, Form.NONE),
    ISTORE_1(60, Form.NONE),
    ISTORE_2(61, Form.NONE),
    ISTORE_3(62, Form.NONE),
    LSTORE_0(63, Form.NONE),
    LSTORE_1(64, Form.NONE),
    LSTORE_2(65, Form.NONE),
    LSTORE_3(66, Form.NONE),
    FSTORE_0(67, Form.NONE),
    FSTORE_1(68, Form.NONE),
    FSTORE_2(69, Form.NONE),
    FSTORE_3(70, Form.NONE),
    DSTORE_0(71, Form.NONE),
    DSTORE_1(72, Form.NONE),
    DSTORE_2(73, Form.NONE),
    DSTORE_3(74, Form.NONE),
    ASTORE_0(75, Form.NONE),
    ASTORE_1(76, Form.NONE),
    ASTORE_2(77, Form.NONE),
    ASTORE_3(78, Form.NONE),
    IASTORE(79, Form.NONE),
    LASTORE(80, Form.NONE),
    FASTORE(81, Form.NONE),
    DASTORE(82, Form.NONE),
    AASTORE(83, Form.NONE),
    BASTORE(84, Form.NONE),
    CASTORE(85, Form.NONE),
    SASTORE(86, Form.NONE),
    POP(87, Form.NONE),
    POP2(88, Form.NONE),
    DUP(89, Form.NONE),
    DUP_X1(90, Form.NONE),
    DUP_X2(91, Form.NONE),
    DUP2(92, Form.NONE),
    DUP2_X1(93, Form.NONE),
    DUP2_X2(94, Form.NONE),
    SWAP(95, Form.NONE),
    IADD(96, Form.NONE),
    LADD(97, Form.NONE),
    FADD(98, Form.NONE),
    DADD(99, Form.NONE),
    ISUB(100, Form.NONE),
    LSUB(101, Form.NONE),
    FSUB(102, Form.NONE),
    DSUB(103, Form.NONE),
    IMUL(104, Form.NONE),
    LMUL(105, Form.NONE),
    FMUL(106, Form.NONE),
    DMUL(107, Form.NONE),
    IDIV(108, Form.NONE),
    LDIV(109, Form.NONE),
    FDIV(110, Form.NONE),
    DDIV(111, Form.NONE),
    IREM(112, Form.NONE),
    LREM(113, Form.NONE),
    FREM(114, Form.NONE),
    DREM(115, Form.NONE),
    INEG(116, Form.NONE),
    LNEG(117, Form.NONE),
    FNEG(118, Form.NONE),
    DNEG(119, Form.NONE),
    ISHL(120, Form.NONE),
    LSHL(121, Form.NONE),
    ISHR(122, Form.NONE),
    LSHR(123, Form.NONE),
    IUSHR(124, Form.NONE),
    LUSHR(125, Form.NONE),
    IAND(126, Form.NONE),
    LAND(127, Form.NONE),
    IOR(128, Form.NONE),
    LOR(129, Form.NONE),
    IXOR(130, Form.NONE),
    LXOR(131, Form.NONE),
    IINC(132, Form.IINC),
    I2L(133, Form.NONE),
    I2F(134, Form.NONE),
    I2D(135, Form.NONE),
    L2I(136, Form.NONE),
    L2F(137, Form.NONE),
    L2D(138, Form.NONE),
    F2I(139, Form.NONE),
    F2L(140, Form.NONE),
    F2D(141, Form.NONE),
    D2I(142, Form.NONE),
    D2L(143, Form.NONE),
    D2F(144, Form.NONE),
    I2B(145, Form.NONE),
    I2C(146, Form.NONE),
    I2S(147, Form.NONE),
    LCMP(148, Form.NONE),
    FCMPL(149, Form.NONE),
    FCMPG(150, Form.NONE),
    DCMPL(151, Form.NONE),
    DCMPG(152, Form.NONE),
    IFEQ(153, Form.JUMP),
    IFNE(154, Form.JUMP),
    IFLT(155, Form.JUMP),
    IFGE(156, Form.JUMP),
    IFGT(157, Form.JUMP),
    IFLE(158, Form.JUMP),
    IF_ICMPEQ(159, Form.JUMP),
    IF_ICMPNE(160, Form.JUMP),
    IF_ICMPLT(161, Form.JUMP),
    IF_ICMPGE(162, Form.JUMP),
    IF_ICMPGT(163, Form.JUMP),
    IF_ICMPLE(164, Form.JUMP),
    IF_ACMPEQ(165, Form.JUMP),
    IF_ACMPNE(166, Form.JUMP),
    GOTO(167, Form.JUMP),
    JSR(168, Form.JUMP),
    RET(169, Form.LOCAL),
    TABLESWITCH(170, Form.TABLE_SWITCH),
    LOOKUPSWITCH(171, Form.LOOKUP_SWITCH),
    IRETURN(172, Form.NONE),
    LRETURN(173, Form.NONE),
    FRETURN(174, Form.NONE),
    DRETURN(175, Form.NONE),
    ARETURN(176, Form.NONE),
    RETURN(177, Form.NONE),
    GETSTATIC(178, Form.REFERENCE),
    PUTSTATIC(179, Form.REFERENCE),
    GETFIELD(180, Form.REFERENCE),
    PUTFIELD(181, Form.REFERENCE),
    INVOKEVIRTUAL(182, Form.REFERENCE),
    INVOKESPECIAL(183, Form.REFERENCE),
    INVOKESTATIC(184, Form.REFERENCE),
    INVOKEINTERFACE(185, Form.REFERENCE),
    INVOKEDYNAMIC(186, Form.REFERENCE),
    NEW(187, Form.REFERENCE),
    NEWARRAY(188, Form.NEW_ARRAY),
    ANEWARRAY(189, Form.REFERENCE),
    ARRAYLENGTH(190, Form.NONE),
    ATHROW(191, Form.NONE),
    CHECKCAST(192, Form.REFERENCE),
    INSTANCEOF(193, Form.REFERENCE),
    MONITORENTER(194, Form.NONE),
    MONITOREXIT(195, Form.NONE),
    WIDE(196, Form.NONE),
    MULTIANEWARRAY(197, Form.REFERENCE),
    IFNULL(198, Form.JUMP),
    IFNONNULL(199, Form.JUMP),
    GOTO_W(200, Form.JUMP),
    JSR_W(201, Form.JUMP),
    BREAKPOINT(202, Form.NONE),
    IMPDEP1(254, Form.NONE),
    IMPDEP2(255, Form.NONE);

    private static final Opcode[] BY_CODE = new Opcode[256];

    static {
        for (Opcode value : values()) {
            BY_CODE[value.code] = value;
        }
    }

    /**
     * The byte value of this opcode.
     */
    public final int code;
    /**
     * The form of this opcode's operands.
     */
    public final Form form;

    Opcode(int code, Form form) {
        this.code = code;
        this.form = form;
    }

    /**
     * Look up an opcode by its byte value.
     *
     * @param code The byte value, {@code 0..255}.
     * @return The opcode, or null if no opcode has this value.
     */
    public static @Nullable Opcode fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) return null;
        return BY_CODE[code];
    }

    /**
     * Get the mnemonic of this opcode, as javap prints it.
     *
     * @return The mnemonic.
     */
    public String mnemonic() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return mnemonic();
    }

    /**
     * The operand forms of instructions.
     */
    public enum Form {
        NONE,
        LOCAL,
        IINC,
        PUSH,
        CONSTANT,
        JUMP,
        NEW_ARRAY,
        TABLE_SWITCH,
        LOOKUP_SWITCH,
        /**
         * Constant pool references to members or types, such as {@code getfield} or {@code checkcast}.
         */
        REFERENCE,
    }
}
