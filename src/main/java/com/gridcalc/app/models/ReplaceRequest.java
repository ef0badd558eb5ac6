package com.gridcalc.app.models;

/**
 * Body of POST /sheet/{id}/replace. Both strings are taken literally.
 */
public class ReplaceRequest {
    private String find;
    private String replace;

    public ReplaceRequest() {
    }

    public ReplaceRequest(String find, String replace) {
        this.find = find;
        this.replace = replace;
    }

    public String getFind() {
        return find;
    }
    public String getReplace() {
        return replace;
    }
    public void setFind(String find) {
        this.find = find;
    }
    public void setReplace(String replace) {
        this.replace = replace;
    }
}
