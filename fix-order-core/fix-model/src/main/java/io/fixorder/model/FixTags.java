package io.fixorder.model;

public final class FixTags {
    public static final int BEGIN_STRING = 8;
    public static final int BODY_LENGTH = 9;
    public static final int CHECK_SUM = 10;
    public static final int CL_ORD_ID = 11;
    public static final int HANDL_INST = 21;
    public static final int MSG_SEQ_NUM = 34;
    public static final int MSG_TYPE = 35;
    public static final int ORDER_QTY = 38;
    public static final int ORD_TYPE = 40;
    public static final int PRICE = 44;
    public static final int SENDER_COMP_ID = 49;
    public static final int SENDING_TIME = 52;
    public static final int SIDE = 54;
    public static final int SYMBOL = 55;
    public static final int TARGET_COMP_ID = 56;
    public static final int TRANSACT_TIME = 60;

    public static final String FIX_4_2 = "FIX.4.2";
    public static final String MSG_TYPE_NEW_ORDER_SINGLE = "D";
    public static final String HANDL_INST_AUTOMATED = "1";
    public static final String ORD_TYPE_LIMIT = "2";

    private FixTags() {
    }
}
